package org.carball.widgetq.model.widget;

public record Pagination(Integer page, Integer pageSize) {

    public static Pagination of(int page, int pageSize) {
        return new Pagination(page, pageSize);
    }

    public static Pagination unspecified() {
        return new Pagination(null, null);
    }

    /**
     * Missing or non-positive values fall back to the given defaults.
     */
    public Pagination withDefaults(int defaultPage, int defaultPageSize) {
        int resolvedPage = page == null || page < 1 ? defaultPage : page;
        int resolvedPageSize = pageSize == null || pageSize < 1 ? defaultPageSize : pageSize;
        return new Pagination(resolvedPage, resolvedPageSize);
    }
}
