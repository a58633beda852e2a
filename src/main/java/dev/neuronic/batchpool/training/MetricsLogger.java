package dev.neuronic.batchpool.training;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Export and persist training metrics for analysis and comparison.
 *
 * <p><b>Supported formats:</b>
 * <ul>
 *   <li><b>JSON:</b> complete metrics with metadata for programmatic analysis</li>
 *   <li><b>CSV:</b> epoch-by-epoch rows for spreadsheets and plotting</li>
 * </ul>
 * A path ending in {@code .zst} is written Zstd-compressed; {@link #readExport(Path)} reads both forms.
 * Non-finite values are written as {@code null} in JSON and as an empty field in CSV.
 *
 * <pre>{@code
 * MetricsLogger.exportToJson(metrics, Path.of("run.json.zst"), Map.of("workers", 8));
 * MetricsLogger.exportToCsv(metrics, Path.of("run.csv"));
 * }</pre>
 */
public final class MetricsLogger {

    /** Suffix that selects Zstd compression. */
    public static final String ZSTD_SUFFIX = ".zst";

    // 1=fast, 22=max compression, 3=good balance
    private static final int COMPRESSION_LEVEL = 3;

    private MetricsLogger() {}

    public static void exportToJson(TrainingMetrics metrics, Path filePath) throws IOException {
        exportToJson(metrics, filePath, Map.of());
    }

    /**
     * Export training metrics to JSON with custom metadata.
     */
    public static void exportToJson(TrainingMetrics metrics, Path filePath, Map<String, Object> metadata) throws IOException {
        StringBuilder json = new StringBuilder();
        json.append("{\n");

        json.append("  \"metadata\": {\n");
        json.append("    \"export_time\": \"").append(Instant.now()).append("\",\n");
        json.append("    \"total_epochs\": ").append(metrics.getEpochCount()).append(",\n");
        json.append("    \"total_rounds\": ").append(metrics.getTotalRounds()).append(",\n");
        json.append("    \"total_batches\": ").append(metrics.getTotalBatches()).append(",\n");
        json.append("    \"rejected_contributions\": ").append(metrics.getTotalRejected()).append(",\n");
        json.append("    \"clipped_contributions\": ").append(metrics.getTotalClipped()).append(",\n");
        json.append("    \"mean_clip_scale\": ").append(jsonNumber(metrics.getMeanClipScale())).append(",\n");
        json.append("    \"training_duration_ms\": ").append(metrics.getTotalTrainingTime().toMillis()).append(",\n");
        json.append("    \"best_loss\": ").append(jsonNumber(metrics.getBestLoss())).append(",\n");
        json.append("    \"best_epoch\": ").append(metrics.getBestEpoch());

        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            json.append(",\n    \"").append(escape(entry.getKey())).append("\": ");
            Object value = entry.getValue();
            if (value instanceof Number || value instanceof Boolean) {
                json.append(value instanceof Double || value instanceof Float
                    ? jsonNumber(((Number) value).doubleValue()) : value.toString());
            } else {
                json.append("\"").append(escape(String.valueOf(value))).append("\"");
            }
        }
        json.append("\n  },\n");

        json.append("  \"epochs\": [\n");
        List<TrainingMetrics.EpochMetrics> epochHistory = metrics.getAllEpochMetrics();
        for (int i = 0; i < epochHistory.size(); i++) {
            TrainingMetrics.EpochMetrics epoch = epochHistory.get(i);
            json.append("    {\n");
            json.append("      \"epoch\": ").append(epoch.getEpochNumber()).append(",\n");
            json.append("      \"average_loss\": ").append(jsonNumber(epoch.getAverageLoss())).append(",\n");
            json.append("      \"rounds\": ").append(epoch.getRounds()).append(",\n");
            json.append("      \"batches\": ").append(epoch.getBatches()).append(",\n");
            json.append("      \"rejected\": ").append(epoch.getRejected()).append(",\n");
            json.append("      \"clipped\": ").append(epoch.getClipped()).append(",\n");
            json.append("      \"mean_clip_scale\": ").append(jsonNumber(epoch.getMeanClipScale())).append(",\n");
            json.append("      \"aborted\": ").append(epoch.isAborted()).append(",\n");
            json.append("      \"epoch_time_ms\": ").append(epoch.getEpochTime().toMillis()).append("\n");
            json.append("    }");
            if (i < epochHistory.size() - 1)
                json.append(",");
            json.append("\n");
        }
        json.append("  ],\n");

        json.append("  \"summary\": {\n");
        json.append("    \"loss_history\": ").append(formatDoubleArray(metrics.getLossHistory())).append(",\n");
        json.append("    \"round_loss_history\": ").append(formatDoubleArray(metrics.getRoundLossHistory())).append("\n");
        json.append("  }\n");
        json.append("}\n");

        writeText(filePath, json.toString());
    }

    /**
     * Export epoch rows to CSV.
     */
    public static void exportToCsv(TrainingMetrics metrics, Path filePath) throws IOException {
        StringBuilder csv = new StringBuilder();
        csv.append("epoch,average_loss,rounds,batches,rejected,clipped,mean_clip_scale,aborted,epoch_time_ms\n");

        for (TrainingMetrics.EpochMetrics epoch : metrics.getAllEpochMetrics()) {
            csv.append(epoch.getEpochNumber()).append(",");
            csv.append(csvNumber(epoch.getAverageLoss())).append(",");
            csv.append(epoch.getRounds()).append(",");
            csv.append(epoch.getBatches()).append(",");
            csv.append(epoch.getRejected()).append(",");
            csv.append(epoch.getClipped()).append(",");
            csv.append(csvNumber(epoch.getMeanClipScale())).append(",");
            csv.append(epoch.isAborted()).append(",");
            csv.append(epoch.getEpochTime().toMillis()).append("\n");
        }

        writeText(filePath, csv.toString());
    }

    /**
     * Read back an exported file, decompressing {@code .zst} paths.
     */
    public static String readExport(Path filePath) throws IOException {
        if (!isCompressed(filePath))
            return Files.readString(filePath, StandardCharsets.UTF_8);

        try (InputStream fileIn = Files.newInputStream(filePath);
             BufferedInputStream buffered = new BufferedInputStream(fileIn, 64 * 1024);
             ZstdInputStream zstdIn = new ZstdInputStream(buffered)) {
            return new String(zstdIn.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Generate a formatted training report.
     */
    public static String generateReport(TrainingMetrics metrics, Map<String, Object> metadata) {
        StringBuilder report = new StringBuilder();
        report.append("=".repeat(60)).append("\n");
        report.append("TRAINING REPORT\n");
        report.append("=".repeat(60)).append("\n\n");

        if (!metadata.isEmpty()) {
            report.append("CONFIGURATION:\n");
            report.append("-".repeat(30)).append("\n");
            for (Map.Entry<String, Object> entry : metadata.entrySet())
                report.append(String.format("  %-20s: %s\n", entry.getKey(), entry.getValue()));
            report.append("\n");
        }

        report.append(metrics.getSummary()).append("\n\n");

        List<TrainingMetrics.EpochMetrics> epochs = metrics.getAllEpochMetrics();
        if (!epochs.isEmpty()) {
            report.append("RECENT EPOCHS:\n");
            report.append("-".repeat(30)).append("\n");
            for (int i = Math.max(0, epochs.size() - 5); i < epochs.size(); i++)
                report.append("  ").append(epochs.get(i)).append("\n");
        }

        report.append("\n").append("=".repeat(60)).append("\n");
        return report.toString();
    }

    public static void printReport(TrainingMetrics metrics) {
        System.out.println(generateReport(metrics, Map.of()));
    }

    // Helper methods

    static boolean isCompressed(Path filePath) {
        Path name = filePath.getFileName();
        return name != null && name.toString().endsWith(ZSTD_SUFFIX);
    }

    private static void writeText(Path filePath, String text) throws IOException {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (!isCompressed(filePath)) {
            Files.write(filePath, bytes);
            return;
        }
        try (OutputStream fileOut = Files.newOutputStream(filePath);
             BufferedOutputStream buffered = new BufferedOutputStream(fileOut, 64 * 1024);
             ZstdOutputStream zstdOut = new ZstdOutputStream(buffered, COMPRESSION_LEVEL)) {
            zstdOut.write(bytes);
        }
    }

    private static String jsonNumber(double value) {
        return Double.isFinite(value) ? String.format(Locale.ROOT, "%.6f", value) : "null";
    }

    private static String csvNumber(double value) {
        return Double.isFinite(value) ? String.format(Locale.ROOT, "%.6f", value) : "";
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String formatDoubleArray(double[] array) {
        if (array.length == 0) return "[]";

        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < array.length; i++) {
            sb.append(jsonNumber(array[i]));
            if (i < array.length - 1) sb.append(", ");
        }
        sb.append("]");
        return sb.toString();
    }
}
