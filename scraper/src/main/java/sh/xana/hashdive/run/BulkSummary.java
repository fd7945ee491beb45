package sh.xana.hashdive.run;

public record BulkSummary(int total, int succeeded, int skipped, int failed) {}
