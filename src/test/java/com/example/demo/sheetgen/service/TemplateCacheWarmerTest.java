package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.exception.TemplateConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TemplateCacheWarmerTest {

    private ReportTemplateLoader loader;
    private TemplateCacheWarmer warmer;

    @BeforeEach
    void setup() {
        loader = mock(ReportTemplateLoader.class);
        warmer = new TemplateCacheWarmer(loader);
        ReflectionTestUtils.setField(warmer, "cacheEnabled", true);
    }

    @Test
    public void testFailingTemplateDoesNotStopWarming() {
        ReflectionTestUtils.setField(warmer, "preloadTemplateIds", List.of("broken", " good "));
        when(loader.loadTemplateSource("broken"))
                .thenThrow(new TemplateConfigException("TEMPLATE_NOT_FOUND", "missing"));
        when(loader.loadTemplateSource("good")).thenReturn("sheets: []".getBytes());

        warmer.warmCache();

        verify(loader).loadTemplateSource("broken");
        verify(loader).loadTemplateSource("good");
        verify(loader).parse(any(byte[].class), any());
    }

    @Test
    public void testDisabledCacheSkipsWarming() {
        ReflectionTestUtils.setField(warmer, "cacheEnabled", false);
        ReflectionTestUtils.setField(warmer, "preloadTemplateIds", List.of("good"));

        warmer.warmCache();

        verify(loader, never()).loadTemplateSource(anyString());
    }

    @Test
    public void testNoConfiguredIdsSkipsWarming() {
        ReflectionTestUtils.setField(warmer, "preloadTemplateIds", List.of());

        warmer.warmCache();

        verify(loader, never()).loadTemplateSource(anyString());
    }
}
