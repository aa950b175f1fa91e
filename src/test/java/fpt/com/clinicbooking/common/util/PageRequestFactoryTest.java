package fpt.com.clinicbooking.common.util;

import fpt.com.clinicbooking.common.config.ClinicProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PageRequestFactoryTest {

    private PageRequestFactory factory;

    @BeforeEach
    void setUp() {
        ClinicProperties properties = new ClinicProperties();
        properties.getPagination().setDefaultSize(10);
        properties.getPagination().setMaxSize(50);
        factory = new PageRequestFactory(properties);
    }

    @Test
    void of_usesDefaults_whenParametersMissing() {
        Pageable pageable = factory.of(null, null, Sort.by("name"));

        assertEquals(0, pageable.getPageNumber());
        assertEquals(10, pageable.getPageSize());
        assertEquals(Sort.by("name"), pageable.getSort());
    }

    @Test
    void of_clampsSizeToConfiguredMaximum() {
        assertEquals(50, factory.of(2, 500, Sort.unsorted()).getPageSize());
    }

    @Test
    void of_treatsNegativePageAsFirst() {
        assertEquals(0, factory.of(-3, 5, Sort.unsorted()).getPageNumber());
    }
}
