package org.analytics.dataquery.tests;

import org.analytics.dataquery.rest.DataQueryClient;
import org.analytics.dataquery.rest.DataRequest;
import org.analytics.dataquery.rest.config.ClientSettings;
import org.analytics.dataquery.rest.exception.DataQueryException;
import org.analytics.dataquery.rest.exception.InvalidSortException;
import org.analytics.dataquery.rest.exception.ResponseDecodeException;
import org.analytics.dataquery.rest.exception.ServiceException;
import org.analytics.dataquery.rest.exception.TransportException;
import org.analytics.dataquery.rest.service.HttpClientTransport;
import org.analytics.dataquery.tests.base.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.util.Iterator;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Errors raised over real HTTP exchanges.
 */
public class ErrorResponseTest extends BaseTest {

    @Override
    protected String getTestResourceDirectory() {
        return "ErrorResponseTest";
    }

    private void stubError(String method, int status, String responseFile) throws Exception {
        wireMockServer.stubFor(post(urlEqualTo(API_PATH + method))
            .willReturn(aResponse()
                .withStatus(status)
                .withHeader("Content-Type", "application/json")
                .withBody(loadStaticResponse(responseFile))));
    }

    @Test
    @DisplayName("Legacy error body raises its specific exception")
    public void testLegacyError() throws Exception {
        stubError("getData", 400, "invalid-sort.json");
        DataRequest request = client.newRequest(visitsQuery().sort("m_unknown").build());

        InvalidSortException e = assertThrows(InvalidSortException.class, () -> request.fetchPage(1));

        assertEquals(400, e.getStatusCode());
        assertEquals(12, e.getErrorCode());
        assertTrue(e.getMessage().contains("m_unknown"));
    }

    @Test
    @DisplayName("Current protocol error body raises ServiceException")
    public void testCurrentError() throws Exception {
        stubError("getTotal", 400, "invalid-filter.json");
        DataRequest request = client.newRequest(visitsQuery().build());

        ServiceException e = assertThrows(ServiceException.class, request::getTotal);

        assertEquals("InvalidFilter: bad filter", e.getMessage());
        assertEquals(400, e.getStatusCode());
    }

    @Test
    @DisplayName("Error during row iteration surfaces from hasNext")
    public void testErrorDuringIteration() throws Exception {
        stubError("getData", 400, "invalid-filter.json");
        Iterator<?> rows = client.newRequest(visitsQuery().build()).getResultRows().iterator();

        assertThrows(ServiceException.class, rows::hasNext);
    }

    @Test
    @DisplayName("HTML error page raises ResponseDecodeException with the raw body")
    public void testHtmlErrorPage() throws Exception {
        wireMockServer.stubFor(post(urlEqualTo(API_PATH + "getData"))
            .willReturn(aResponse()
                .withStatus(502)
                .withHeader("Content-Type", "text/html")
                .withBody(loadStaticResponse("bad-gateway.html"))));
        DataRequest request = client.newRequest(visitsQuery().build());

        ResponseDecodeException e = assertThrows(ResponseDecodeException.class, () -> request.fetchPage(1));

        assertEquals(502, e.getStatusCode());
        assertTrue(e.getMessage().contains("Bad Gateway"));
    }

    @Test
    @DisplayName("Empty JSON object with an error status raises ServiceException")
    public void testStatusOnlyError() {
        wireMockServer.stubFor(post(urlEqualTo(API_PATH + "getRowCount"))
            .willReturn(aResponse()
                .withStatus(503)
                .withStatusMessage("Service Unavailable")
                .withBody("{}")));
        DataRequest request = client.newRequest(visitsQuery().build());

        ServiceException e = assertThrows(ServiceException.class, request::getRowCount);

        assertTrue(e.getMessage().startsWith("HTTP error 503"));
        assertEquals(503, e.getStatusCode());
    }

    @Test
    @DisplayName("Unreachable server raises TransportException with status 0")
    public void testConnectionRefused() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        ClientSettings settings = new ClientSettings();
        settings.setBaseUrl("http://localhost:" + closedPort + "/v3/data");
        settings.setAccessKey("ACCESS");
        settings.setSecretKey("SECRET");

        try (DataQueryClient unreachable = new DataQueryClient(settings, new HttpClientTransport(2, 2))) {
            DataRequest request = unreachable.newRequest(visitsQuery().build());

            DataQueryException e = assertThrows(TransportException.class, () -> request.fetchPage(1));
            assertEquals(0, e.getStatusCode());
            System.out.println("Transport error: " + e.getMessage());
        }
    }
}
