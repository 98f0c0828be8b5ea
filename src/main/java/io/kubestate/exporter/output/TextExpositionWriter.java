package io.kubestate.exporter.output;

import io.kubestate.exporter.metrics.Metric;
import io.kubestate.exporter.metrics.MetricFamily;
import io.kubestate.exporter.metrics.MetricType;
import io.prometheus.client.Collector;
import io.prometheus.client.exporter.common.TextFormat;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Writes metric families in the Prometheus text exposition format (version 0.0.4).
 * Every family keeps its HELP and TYPE lines even when it has no samples.
 */
@Component
public class TextExpositionWriter {

    public static final String CONTENT_TYPE = TextFormat.CONTENT_TYPE_004;

    public String write(List<MetricFamily> families) {
        StringWriter out = new StringWriter();
        try {
            write(families, out);
        } catch (IOException e) {
            throw new UncheckedIOException("writing to a string buffer failed", e);
        }
        return out.toString();
    }

    public void write(List<MetricFamily> families, Writer out) throws IOException {
        List<Collector.MetricFamilySamples> samples = new ArrayList<>(families.size());
        for (MetricFamily family : families) {
            samples.add(toSamples(family));
        }
        TextFormat.write004(out, Collections.enumeration(samples));
    }

    static Collector.MetricFamilySamples toSamples(MetricFamily family) {
        List<Collector.MetricFamilySamples.Sample> samples = new ArrayList<>(family.metrics().size());
        for (Metric metric : family.metrics()) {
            samples.add(new Collector.MetricFamilySamples.Sample(
                    family.name(), metric.labelKeys(), metric.labelValues(), metric.value()));
        }
        // counters are declared with their _total suffix; simpleclient adds it back to the headers
        return new Collector.MetricFamilySamples(family.name(), toType(family.type()), family.help(), samples);
    }

    private static Collector.Type toType(MetricType type) {
        return switch (type) {
            case COUNTER -> Collector.Type.COUNTER;
            case GAUGE -> Collector.Type.GAUGE;
        };
    }
}
