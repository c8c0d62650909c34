package com.ietfdata.model.error;

/**
 * A paginated traversal was stopped because its next-page chain revisited a page or ran past the
 * configured maximum number of pages.
 */
public final class PaginationLoopException extends DatatrackerException {

    private final String path;
    private final int pagesFetched;

    private PaginationLoopException(String message, String path, int pagesFetched) {
        super(message);
        this.path = path;
        this.pagesFetched = pagesFetched;
    }

    public static PaginationLoopException revisited(String path, int pagesFetched) {
        return new PaginationLoopException(
                "Pagination loop suspected: %s was already fetched after %d pages".formatted(path, pagesFetched),
                path,
                pagesFetched);
    }

    public static PaginationLoopException tooManyPages(String path, int maxPages) {
        return new PaginationLoopException(
                "Pagination loop suspected: page bound of %d reached before %s".formatted(maxPages, path),
                path,
                maxPages);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PAGINATION_LOOP;
    }

    /** The next-page path at which traversal stopped. */
    public String path() {
        return path;
    }

    public int pagesFetched() {
        return pagesFetched;
    }
}
