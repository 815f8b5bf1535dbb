package gr.imsi.athenarc.historian.tag;

/**
 * Why a requested tag is missing from an export.
 */
public enum DropReason {
    /** The store does not know the tag. */
    NOT_FOUND,
    /** The existence check itself failed. */
    LOOKUP_FAILED,
    /** Every chunk was empty or skipped. */
    NO_DATA,
    /** The request timed out before the tag was fetched. */
    TIMED_OUT,
    /** The fetch task failed unexpectedly. */
    FETCH_FAILED
}
