package gr.imsi.athenarc.historian.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.historian.domain.AggregateInterval;

public class ExportRequestTest {

    private static ExportRequest.Builder valid() {
        return ExportRequest.builder()
                .name("boiler")
                .tags(List.of("A"))
                .start(0)
                .end(60_000)
                .interval(AggregateInterval.parse("00:01:00"));
    }

    @Test
    public void testValidRequest() {
        ExportRequest request = valid().build();
        request.validate();
        assertEquals(60_000, request.getRange().length());
    }

    @Test
    public void testRejectsEmptyOrBlankTags() {
        assertThrows(InvalidExportRequestException.class, () -> valid().tags(List.of()).build().validate());
        assertThrows(InvalidExportRequestException.class, () -> valid().tags(List.of("A", " ")).build().validate());
        assertThrows(InvalidExportRequestException.class, () -> valid().tags(Arrays.asList("A", null)).build().validate());
    }

    @Test
    public void testRejectsEmptyRange() {
        assertThrows(InvalidExportRequestException.class, () -> valid().end(0).build().validate());
        assertThrows(InvalidExportRequestException.class, () -> valid().start(120_000).build().validate());
    }

    @Test
    public void testRejectsMissingIntervalOrName() {
        assertThrows(InvalidExportRequestException.class, () -> valid().interval(null).build().validate());
        assertThrows(InvalidExportRequestException.class, () -> valid().name(" ").build());
    }

    @Test
    public void testNameMustBePlainFileName() {
        assertThrows(InvalidExportRequestException.class, () -> valid().name("../../tmp/x").build());
        assertThrows(InvalidExportRequestException.class, () -> valid().name("a/b").build());
        assertThrows(InvalidExportRequestException.class, () -> valid().name("a\\b").build());
        assertEquals("boiler-2024.v2", valid().name("boiler-2024.v2").build().getName());
    }
}
