package Server.http;

import Server.http.filters.AccessLogFilter;
import Server.http.filters.CorrelationIdFilter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApiFiltersTest {

    @Test
    void correlationWrapsAccessLogWhichWrapsTheRest() {
        ApiFilters filters = new ApiFilters(record -> {}, Duration.ofSeconds(30));
        List<Stage> stages = filters.all();

        assertInstanceOf(CorrelationIdFilter.class, stages.get(0));
        assertInstanceOf(AccessLogFilter.class, stages.get(1));
        assertSame(filters.correlationId(), stages.get(0));
        assertSame(filters.accessLog(), stages.get(1));
        assertSame(filters.drainGate(), stages.get(2));
        assertSame(filters.errorTracking(), stages.get(3));
    }

    @Test
    void instancesDoNotShareStages() {
        ApiFilters a = new ApiFilters(record -> {}, Duration.ofSeconds(30));
        ApiFilters b = new ApiFilters(record -> {}, Duration.ofSeconds(30));
        assertNotSame(a.accessLog(), b.accessLog());
    }

    @Test
    void pipelineKeepsStageOrder() {
        ApiFilters filters = new ApiFilters(record -> {}, Duration.ofSeconds(30));
        Pipeline pipeline = Pipeline.of(filters.all(), new HandlerRegistry());
        assertEquals(filters.all(), pipeline.stages());
    }
}
