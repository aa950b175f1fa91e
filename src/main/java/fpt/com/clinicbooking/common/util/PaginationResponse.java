package fpt.com.clinicbooking.common.util;

import lombok.*;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * Standard envelope for paged listings.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaginationResponse<T> {

    private List<T> items;
    private int currentPage;
    private int totalPages;
    private long totalElements;
    private int pageSize;

    public static <E, T> PaginationResponse<T> fromPage(Page<E> page, Function<E, T> mapper) {
        return PaginationResponse.<T>builder()
                .items(page.getContent().stream().map(mapper).toList())
                .currentPage(page.getNumber())
                .totalPages(page.getTotalPages())
                .totalElements(page.getTotalElements())
                .pageSize(page.getSize())
                .build();
    }
}
