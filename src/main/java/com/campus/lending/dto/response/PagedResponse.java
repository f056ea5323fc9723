package com.campus.lending.dto.response;

import org.springframework.data.domain.Page;

import java.util.List;

/**
 * Stable JSON shape for paginated lists, independent of Spring Data's {@code PageImpl}
 * serialisation.
 */
public record PagedResponse<T>(
    List<T> content,
    int page,
    int size,
    long totalElements,
    int totalPages
) {
    public static <T> PagedResponse<T> from(Page<T> page) {
        return new PagedResponse<>(
            page.getContent(),
            page.getNumber(),
            page.getSize(),
            page.getTotalElements(),
            page.getTotalPages()
        );
    }
}
