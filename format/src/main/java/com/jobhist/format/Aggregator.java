package com.jobhist.format;

import com.jobhist.record.FieldValue;
import com.jobhist.record.Record;

import java.util.ArrayList;
import java.util.List;

/**
 * Averages the numeric output columns in one pass, keeping only a count and
 * a sum per column. Records are not retained.
 *
 * <p>A record adds to a column's average only when it has a readable value
 * for it; the summary's record count includes every record seen.</p>
 */
public class Aggregator {

    private final List<ColumnSpec> columns = new ArrayList<>();
    private final long[] samples;
    private final double[] sums;
    private long recordCount;

    /**
     * @param columns the output columns; non-numeric ones are ignored
     */
    public Aggregator(List<ColumnSpec> columns) {
        for (ColumnSpec column : columns) {
            if (column.getField().kind().isNumeric()) {
                this.columns.add(column);
            }
        }
        this.samples = new long[this.columns.size()];
        this.sums = new double[this.columns.size()];
    }

    public void accept(Record record) {
        recordCount++;
        for (int i = 0; i < columns.size(); i++) {
            ColumnSpec column = columns.get(i);
            FieldValue value = record.get(column.getName());
            if (value != null && value.isCoerced() && value.kind() == column.getField().kind()) {
                sums[i] += value.numericValue();
                samples[i]++;
            }
        }
    }

    public long getRecordCount() {
        return recordCount;
    }

    public AggregateSummary summary() {
        List<AggregateSummary.ColumnAverage> averages = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            averages.add(new AggregateSummary.ColumnAverage(columns.get(i), samples[i], sums[i]));
        }
        return new AggregateSummary(recordCount, averages);
    }
}
