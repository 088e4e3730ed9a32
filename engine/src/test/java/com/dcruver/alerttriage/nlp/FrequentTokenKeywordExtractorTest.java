package com.dcruver.alerttriage.nlp;

import com.dcruver.alerttriage.domain.Alert;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dcruver.alerttriage.TestAlerts.json;
import static org.junit.jupiter.api.Assertions.*;

class FrequentTokenKeywordExtractorTest {

    private final FrequentTokenKeywordExtractor extractor = new FrequentTokenKeywordExtractor();

    private Alert withData(String id, String data) {
        return Alert.builder().id(id).data(json(data)).build();
    }

    @Test
    void testPicksTokensSharedByAlerts() {
        List<Alert> alerts = List.of(
            withData("a1", "{\"event\":\"GuardDuty finding\",\"src\":{\"ip\":\"10.0.0.1\"},\"severity\":\"high\"}"),
            withData("a2", "{\"event\":\"GuardDuty finding\",\"src\":{\"ip\":\"10.0.0.2\"},\"severity\":\"low\"}"),
            withData("a3", "{\"event\":\"GuardDuty anomaly\",\"user\":\"alice\"}")
        );

        List<String> keywords = extractor.extract(alerts, 3);

        // guardduty and event are in all three alerts, ties broken alphabetically
        assertEquals(List.of("event", "guardduty", "finding"), keywords);
    }

    @Test
    void testDropsNumbersStopwordsAndShortTokens() {
        List<Alert> alerts = List.of(
            withData("a1", "{\"id\":\"12345\",\"msg\":\"the ok port 443\"}"),
            withData("a2", "{\"id\":\"12345\",\"msg\":\"the ok port 443\"}")
        );

        List<String> keywords = extractor.extract(alerts, 10);

        assertEquals(List.of("msg", "port"), keywords);
    }

    @Test
    void testTokensFromOneAlertOnlyAreIgnored() {
        List<Alert> alerts = List.of(
            withData("a1", "{\"action\":\"login\"}"),
            withData("a2", "{\"action\":\"download\"}")
        );

        assertEquals(List.of("action"), extractor.extract(alerts, 5));
    }

    @Test
    void testEmptyInput() {
        assertTrue(extractor.extract(List.of(), 5).isEmpty());
        assertTrue(extractor.extract(List.of(Alert.builder().id("x").build()), 5).isEmpty());
    }
}
