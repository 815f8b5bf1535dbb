package gr.imsi.athenarc.historian.fetch;

public enum FetchMode {
    /** Buckets are averaged by the store on the request grid. */
    AGGREGATE,
    /** The store resamples the series itself at the interval step. */
    NATIVE_RESAMPLE
}
