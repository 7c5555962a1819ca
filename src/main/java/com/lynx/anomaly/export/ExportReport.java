package com.lynx.anomaly.export;

import java.nio.file.Path;
import java.util.List;

public record ExportReport(Path directory, List<String> files, boolean interchangeExported) {
}
