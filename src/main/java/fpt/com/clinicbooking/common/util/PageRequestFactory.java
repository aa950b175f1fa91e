package fpt.com.clinicbooking.common.util;

import fpt.com.clinicbooking.common.config.ClinicProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

/**
 * Builds {@link Pageable}s from raw query parameters, clamped to the configured limits.
 */
@Component
@RequiredArgsConstructor
public class PageRequestFactory {

    private final ClinicProperties properties;

    public Pageable of(Integer page, Integer size, Sort sort) {
        ClinicProperties.Pagination cfg = properties.getPagination();
        int p = (page == null || page < 0) ? 0 : page;
        int s = (size == null || size <= 0) ? cfg.getDefaultSize() : Math.min(size, cfg.getMaxSize());
        return PageRequest.of(p, s, sort);
    }
}
