package com.mockbuster.server.domain.film;

/**
 * 영화 목록 조회 조건.
 * <p>
 * title, category 는 부분 일치(대소문자 무시), rating 은 정확히 일치한다.
 * 빈 문자열/null 인 조건은 적용하지 않는다.
 */
public record FilmFilters(
        String title,
        String rating,
        String category,
        int page,
        int limit
) {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public static FilmFilters of(int page, int limit) {
        return new FilmFilters(null, null, null, page, limit);
    }

    /**
     * 0 이하의 page/limit 을 기본값(1/10)으로 바꾼 사본
     */
    public FilmFilters withDefaultPagination() {
        int normalizedPage = page <= 0 ? DEFAULT_PAGE : page;
        int normalizedLimit = limit <= 0 ? DEFAULT_LIMIT : limit;
        return new FilmFilters(title, rating, category, normalizedPage, normalizedLimit);
    }

    // page 가 int 최댓값에 가까워도 음수가 되지 않도록 long 으로 계산
    public long offset() {
        return (long) (page - 1) * limit;
    }

    public boolean hasTitle() {
        return title != null && !title.isEmpty();
    }

    public boolean hasRating() {
        return rating != null && !rating.isEmpty();
    }

    public boolean hasCategory() {
        return category != null && !category.isEmpty();
    }
}
