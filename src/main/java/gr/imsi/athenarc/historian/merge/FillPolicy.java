package gr.imsi.athenarc.historian.merge;

/**
 * How empty cells of a merged column are filled. Empty cells are {@code NaN}. Filling a column
 * twice gives the same result as filling it once.
 */
public enum FillPolicy {
    /** Carry the last value forward, then fill leading cells from the first value. */
    FORWARD_BACKWARD {
        @Override
        public void fill(double[] column) {
            forward(column);
            backward(column);
        }
    },
    FORWARD {
        @Override
        public void fill(double[] column) {
            forward(column);
        }
    },
    BACKWARD {
        @Override
        public void fill(double[] column) {
            backward(column);
        }
    },
    /** Leave empty cells empty. */
    NONE {
        @Override
        public void fill(double[] column) {
        }
    };

    /**
     * Fills the empty cells of {@code column} in place.
     */
    public abstract void fill(double[] column);

    static void forward(double[] column) {
        double last = Double.NaN;
        for (int i = 0; i < column.length; i++) {
            if (Double.isNaN(column[i])) {
                column[i] = last;
            } else {
                last = column[i];
            }
        }
    }

    static void backward(double[] column) {
        double next = Double.NaN;
        for (int i = column.length - 1; i >= 0; i--) {
            if (Double.isNaN(column[i])) {
                column[i] = next;
            } else {
                next = column[i];
            }
        }
    }

    public static FillPolicy parse(String s) {
        try {
            return valueOf(s.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown fill policy: " + s, e);
        }
    }
}
