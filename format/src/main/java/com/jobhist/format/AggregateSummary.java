package com.jobhist.format;

import java.util.List;
import java.util.StringJoiner;

/**
 * Per-column averages over the records of one query.
 *
 * @param recordCount number of records aggregated
 * @param averages    one entry per numeric output column, in column order
 */
public record AggregateSummary(long recordCount, List<ColumnAverage> averages) {

    public AggregateSummary {
        averages = List.copyOf(averages);
    }

    /**
     * Running total of one column.
     *
     * @param column  the column
     * @param samples records that had a readable value for the column
     * @param sum     sum of those values (seconds for durations, bytes for memory)
     */
    public record ColumnAverage(ColumnSpec column, long samples, double sum) {

        public boolean hasValue() {
            return samples > 0;
        }

        /**
         * @return the mean, or {@code NaN} if no record had a value
         */
        public double average() {
            return samples > 0 ? sum / samples : Double.NaN;
        }

        /**
         * The mean in the column's display format, or {@code "-"} if no record had a value.
         */
        public String rendered() {
            return samples > 0 ? ValueRenderer.renderAverage(column, average()) : "-";
        }
    }

    /**
     * The summary line, e.g. {@code average over 3 records: numcpus=12.00, elapsed=01:30:00}.
     */
    public String describe() {
        StringBuilder text = new StringBuilder("average over ").append(recordCount)
                .append(recordCount == 1 ? " record" : " records");
        if (!averages.isEmpty()) {
            StringJoiner values = new StringJoiner(", ");
            for (ColumnAverage average : averages) {
                values.add(average.column().getName() + "=" + average.rendered());
            }
            text.append(": ").append(values);
        }
        return text.toString();
    }
}
