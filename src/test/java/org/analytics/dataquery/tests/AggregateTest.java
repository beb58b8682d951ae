package org.analytics.dataquery.tests;

import org.analytics.dataquery.model.filter.FilterEndpoint;
import org.analytics.dataquery.model.filter.FilterOperator;
import org.analytics.dataquery.rest.DataQueryClient;
import org.analytics.dataquery.rest.DataRequest;
import org.analytics.dataquery.rest.config.ClientSettings;
import org.analytics.dataquery.rest.exception.DataShapeException;
import org.analytics.dataquery.rest.json.JsonResponseDecoder;
import org.analytics.dataquery.tests.base.BaseTest;
import org.analytics.dataquery.tests.base.CountingTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Row count and totals of a request.
 */
public class AggregateTest extends BaseTest {

    @Override
    protected String getTestResourceDirectory() {
        return "AggregateTest";
    }

    private static DataQueryClient clientWith(CountingTransport transport) {
        ClientSettings settings = new ClientSettings();
        settings.setBaseUrl("http://localhost/v3/data");
        settings.setAccessKey("ACCESS");
        settings.setSecretKey("SECRET");
        return new DataQueryClient(settings, transport);
    }

    @Test
    @DisplayName("Row count is read from RowCounts[0].RowCount")
    public void testRowCount() throws Exception {
        setupStaticJsonResponse("getRowCount", "rowcount.json");
        DataRequest request = client.newRequest(visitsQuery().build());

        assertEquals(1234L, request.getRowCount());
        verify(1, postRequestedFor(urlEqualTo(API_PATH + "getRowCount")));
    }

    @Test
    @DisplayName("Row count response is fetched once per request")
    public void testRowCountMemoized() {
        CountingTransport transport = CountingTransport.returning(200, "{\"RowCounts\": [{\"RowCount\": 7}]}");
        DataRequest request = clientWith(transport).newRequest(visitsQuery().build());

        assertEquals(7L, request.getRowCount());
        assertEquals(7L, request.getRowCount());
        request.getRowCountResponse();

        assertEquals(1, transport.getCallCount());
        assertTrue(transport.getUrls().get(0).endsWith("/getRowCount"));
    }

    @Test
    @DisplayName("A second request object fetches its own row count")
    public void testRowCountPerRequest() {
        CountingTransport transport = CountingTransport.returning(200, "{\"RowCounts\": [{\"RowCount\": 7}]}");
        DataQueryClient countingClient = clientWith(transport);

        countingClient.newRequest(visitsQuery().build()).getRowCount();
        countingClient.newRequest(visitsQuery().build()).getRowCount();

        assertEquals(2, transport.getCallCount());
    }

    @Test
    @DisplayName("Row count response without RowCount raises DataShapeException")
    public void testRowCountMissing() {
        CountingTransport transport = CountingTransport.returning(200, "{\"RowCounts\": []}");
        DataRequest request = clientWith(transport).newRequest(visitsQuery().build());

        assertThrows(DataShapeException.class, request::getRowCount);
    }

    @Test
    @DisplayName("Totals leave out not applicable values and keep 0 and empty strings")
    public void testTotal() throws Exception {
        setupStaticJsonResponse("getTotal", "total.json");
        DataRequest request = client.newRequest(visitsQuery()
            .columns("src", "m_visits", "m_bounces", "m_time_spent").build());

        Map<String, Object> totals = request.getTotal();

        assertEquals(List.of("m_visits", "m_bounces", "m_time_spent"), List.copyOf(totals.keySet()));
        assertEquals(5340, ((Number) totals.get("m_visits")).intValue());
        assertEquals(0, ((Number) totals.get("m_bounces")).intValue());
        assertEquals("", totals.get("m_time_spent"));
        System.out.println("Totals: " + totals);
    }

    @Test
    @DisplayName("Totals are a copy: the cached response keeps its values")
    public void testTotalIsCopy() {
        CountingTransport transport = CountingTransport.returning(200,
            "{\"DataFeed\": {\"Rows\": [{\"src\": \"-\", \"m_visits\": 3}]}}");
        DataRequest request = clientWith(transport).newRequest(visitsQuery().build());

        Map<String, Object> totals = request.getTotal();
        totals.clear();

        Map<String, Object> again = request.getTotal();
        assertEquals(List.of("m_visits"), List.copyOf(again.keySet()));
        assertEquals(3, ((Number) again.get("m_visits")).intValue());
        assertEquals(1, transport.getCallCount());
    }

    @Test
    @DisplayName("Totals without a first row raise DataShapeException")
    public void testTotalWithoutRows() {
        CountingTransport transport = CountingTransport.returning(200, "{\"DataFeed\": {\"Rows\": []}}");
        DataRequest request = clientWith(transport).newRequest(visitsQuery().build());

        assertThrows(DataShapeException.class, request::getTotal);
    }

    @Test
    @DisplayName("Aggregate requests send the document without paging or sort")
    public void testAggregateBody() {
        CountingTransport transport = CountingTransport.returning(200,
            "{\"RowCounts\": [{\"RowCount\": 1}], \"DataFeed\": {\"Rows\": [{\"m_visits\": 1}]}}");
        DataRequest request = clientWith(transport).newRequest(visitsQuery()
            .sort("-m_visits")
            .maxResults(30)
            .metricFilter(new FilterEndpoint("m_visits", FilterOperator.GREATER, 0))
            .build());

        request.getRowCount();
        request.getTotal();

        assertEquals(2, transport.getCallCount());
        JsonResponseDecoder decoder = new JsonResponseDecoder();
        for (String body : transport.getBodies()) {
            Map<String, Object> sent = decoder.decode(body).orElseThrow();
            assertFalse(sent.containsKey("sort"));
            assertFalse(sent.containsKey("max-results"));
            assertFalse(sent.containsKey("page-num"));
            assertTrue(sent.containsKey("filter"));
        }
        assertEquals(transport.getBodies().get(0), transport.getBodies().get(1));
    }
}
