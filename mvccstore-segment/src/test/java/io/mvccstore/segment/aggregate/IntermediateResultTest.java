package io.mvccstore.segment.aggregate;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import io.mvccstore.segment.index.StoredDocument;
import io.mvccstore.segment.query.TermQuery;
import io.mvccstore.util.JsonUtil;

import static io.mvccstore.segment.TestIndex.row;

public class IntermediateResultTest {
    private static final AggregationSpec SPEC = new AggregationSpec(null, "k", Arrays.asList(
            MetricSpec.count("n"),
            MetricSpec.of("values", MetricType.COUNT, "v"),
            MetricSpec.of("sum", MetricType.SUM, "v"),
            MetricSpec.of("min", MetricType.MIN, "v"),
            MetricSpec.of("max", MetricType.MAX, "v"),
            MetricSpec.of("avg", MetricType.AVG, "v")), 0);

    private static int nextDoc = 0;

    private static StoredDocument doc(Object key, Object value) {
        return new StoredDocument(nextDoc++, nextDoc, false, row("k", key, "v", value));
    }

    @Test
    public void mergeIsTheSameAsCollectingEverything() {
        IntermediateResult a = new IntermediateResult();
        a.collect(SPEC, doc("x", 1), 0);
        a.collect(SPEC, doc("y", 10), 0);
        a.segmentDone();
        IntermediateResult b = new IntermediateResult();
        b.collect(SPEC, doc("x", 5), 0);
        b.collect(SPEC, doc("x", null), 0);
        b.segmentDone();

        IntermediateResult all = new IntermediateResult();
        all.collect(SPEC, doc("x", 1), 0);
        all.collect(SPEC, doc("y", 10), 0);
        all.collect(SPEC, doc("x", 5), 0);
        all.collect(SPEC, doc("x", null), 0);

        AggregationResult merged = AggregationResult.finish(SPEC, new IntermediateResult().merge(a, 0).merge(b, 0));
        Assert.assertEquals(AggregationResult.finish(SPEC, all), merged);
        Assert.assertEquals(4, merged.docCount);

        AggregationResult.Row x = merged.row("x");
        Assert.assertEquals(3, x.docCount);
        Assert.assertEquals(3L, x.value("n"));
        Assert.assertEquals(2L, x.value("values"));
        Assert.assertEquals(6.0, x.value("sum"));
        Assert.assertEquals(1.0, x.value("min"));
        Assert.assertEquals(5.0, x.value("max"));
        Assert.assertEquals(3.0, x.value("avg"));
    }

    @Test
    public void mergeLeavesItsInputAlone() {
        IntermediateResult a = new IntermediateResult();
        a.collect(SPEC, doc("x", 1), 0);
        IntermediateResult target = new IntermediateResult();
        target.merge(a, 0).merge(a, 0);
        Assert.assertEquals(2, target.docCount());
        Assert.assertEquals(1, a.docCount());
        Assert.assertEquals(1L, a.buckets().get("x").metric("n").value(MetricType.COUNT));
    }

    @Test
    public void keysAreNormalized() {
        IntermediateResult r = new IntermediateResult();
        r.collect(SPEC, doc(7, 1), 0);
        r.collect(SPEC, doc(7L, 1), 0);
        r.collect(SPEC, doc(7.0, 1), 0);
        r.collect(SPEC, doc(null, 1), 0);
        Assert.assertEquals(3, r.buckets().get("7").docCount());
        Assert.assertEquals(1, r.buckets().get("null").docCount());
    }

    @Test
    public void rowsAreSortedAndLimited() {
        AggregationSpec limited = new AggregationSpec(null, "k", Collections.singletonList(MetricSpec.count("n")), 2);
        IntermediateResult r = new IntermediateResult();
        for (String k : new String[]{"c", "a", "b", "a"}) {
            r.collect(limited, doc(k, 1), 0);
        }
        AggregationResult result = AggregationResult.finish(limited, r);
        Assert.assertEquals(2, result.rows.size());
        Assert.assertEquals("a", result.rows.get(0).key);
        Assert.assertEquals(2, result.rows.get(0).docCount);
        Assert.assertEquals("b", result.rows.get(1).key);
        Assert.assertEquals(4, result.docCount);
    }

    @Test
    public void ungroupedResultAlwaysHasOneRow() {
        AggregationSpec total = new AggregationSpec(new TermQuery("k", "x"), null, Arrays.asList(
                MetricSpec.count("n"), MetricSpec.of("avg", MetricType.AVG, "v")), 0);
        AggregationResult empty = AggregationResult.finish(total, new IntermediateResult());
        Assert.assertEquals(1, empty.rows.size());
        Assert.assertEquals(IntermediateResult.ALL_KEY, empty.rows.get(0).key);
        Assert.assertEquals(0L, empty.rows.get(0).value("n"));
        Assert.assertNull(empty.rows.get(0).value("avg"));

        IntermediateResult r = new IntermediateResult();
        r.collect(total, doc("x", 4), 0);
        r.collect(total, doc("y", "text"), 0);
        AggregationResult.Row row = AggregationResult.finish(total, r).row(IntermediateResult.ALL_KEY);
        Assert.assertEquals(2L, row.value("n"));
        Assert.assertEquals(4.0, row.value("avg"));
    }

    @Test
    public void bucketLimit() {
        IntermediateResult r = new IntermediateResult();
        r.collect(SPEC, doc("a", 1), 2);
        r.collect(SPEC, doc("b", 1), 2);
        r.collect(SPEC, doc("a", 1), 2);
        try {
            r.collect(SPEC, doc("c", 1), 2);
            Assert.fail();
        } catch (BucketLimitExceededException e) {
            Assert.assertTrue(e.getMessage().contains("bucket limit 2"));
        }

        IntermediateResult other = new IntermediateResult();
        other.collect(SPEC, doc("z", 1), 0);
        try {
            r.merge(other, 2);
            Assert.fail();
        } catch (BucketLimitExceededException e) {
            // expected
        }
    }

    @Test
    public void partialResultsTravelAsJson() throws Exception {
        IntermediateResult r = new IntermediateResult();
        r.collect(SPEC, doc("x", 1.5), 0);
        r.collect(SPEC, doc("y", "not a number"), 0);
        r.segmentDone();

        IntermediateResult back = JsonUtil.fromJsonBytes(JsonUtil.toJsonBytes(r), IntermediateResult.class);
        Assert.assertEquals(1, back.segmentCount());
        Assert.assertEquals(AggregationResult.finish(SPEC, r), AggregationResult.finish(SPEC, back));
        Assert.assertNull(AggregationResult.finish(SPEC, back).row("y").value("sum"));
        Assert.assertEquals(1L, AggregationResult.finish(SPEC, back).row("y").value("values"));
    }

    @Test
    public void specTravelsAsJson() throws Exception {
        AggregationSpec back = JsonUtil.fromJsonBytes(JsonUtil.toJsonBytes(SPEC), AggregationSpec.class);
        Assert.assertEquals(SPEC.toString(), back.toString());
        Assert.assertTrue(back.isGrouped());
        Assert.assertEquals(6, back.metrics.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void metricNamesAreUnique() {
        new AggregationSpec(null, null, Arrays.asList(MetricSpec.count("n"), MetricSpec.count("n")), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void fieldMetricNeedsAField() {
        MetricSpec.of("sum", MetricType.SUM, null);
    }
}
