package com.finlens.backend.exceptions;

public class RowLimitExceededException extends StatementProcessingException {

    private final int rowCount;
    private final int maxRows;

    public RowLimitExceededException(int rowCount, int maxRows) {
        super("Statement has " + rowCount + " rows, exceeding the limit of " + maxRows + "; nothing was processed");
        this.rowCount = rowCount;
        this.maxRows = maxRows;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getMaxRows() {
        return maxRows;
    }
}
