package org.analytics.dataquery.tests;

import org.analytics.dataquery.model.filter.FilterEndpoint;
import org.analytics.dataquery.model.filter.FilterOperator;
import org.analytics.dataquery.model.period.Granularity;
import org.analytics.dataquery.model.period.RelativePeriod;
import org.analytics.dataquery.rest.DataRequest;
import org.analytics.dataquery.tests.base.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.*;

/**
 * Tests that verify the HTTP requests sent to the data API.
 */
public class RequestHeadersTest extends BaseTest {

    @Override
    protected String getTestResourceDirectory() {
        return "RequestHeadersTest";
    }

    private void stubGetData() {
        wireMockServer.stubFor(post(urlEqualTo(API_PATH + "getData"))
            .willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody(dataFeedPage(0, 1))));
    }

    @Test
    @DisplayName("Credential and content type headers are sent")
    public void testHeaders() {
        stubGetData();

        client.newRequest(visitsQuery().build()).fetchPage(1);

        verify(postRequestedFor(urlEqualTo(API_PATH + "getData"))
            .withHeader("x-api-key", equalTo("ACCESS_SECRET"))
            .withHeader("Content-Type", containing("application/json")));
    }

    @Test
    @DisplayName("Request body is the rendered query document")
    public void testRequestBody() {
        stubGetData();

        client.newRequest(visitsQuery()
                .period(new RelativePeriod(Granularity.MONTH, -1))
                .propertyFilter(new FilterEndpoint("src", FilterOperator.EQUALS, "Direct traffic"))
                .sort("-m_visits")
                .pageSize(50)
                .build())
            .fetchPage(2);

        verify(postRequestedFor(urlEqualTo(API_PATH + "getData"))
            .withRequestBody(matchingJsonPath("$.space.s[0]", equalTo("1")))
            .withRequestBody(matchingJsonPath("$.columns[0]", equalTo("m_visits")))
            .withRequestBody(matchingJsonPath("$.period.p1[0].type", equalTo("R")))
            .withRequestBody(matchingJsonPath("$.period.p1[0].granularity", equalTo("M")))
            .withRequestBody(matchingJsonPath("$['page-num']", equalTo("2")))
            .withRequestBody(matchingJsonPath("$['max-results']", equalTo("50")))
            .withRequestBody(matchingJsonPath("$.filter.property.src['$eq']", equalTo("Direct traffic")))
            .withRequestBody(matchingJsonPath("$.sort[0]", equalTo("-m_visits")))
            .withRequestBody(matchingJsonPath("$.options.ignore_null_properties", equalTo("false"))));
    }

    @Test
    @DisplayName("Each method is posted to its own path under the base URL")
    public void testMethodPaths() {
        wireMockServer.stubFor(post(urlEqualTo(API_PATH + "getRowCount"))
            .willReturn(okJson("{\"RowCounts\": [{\"RowCount\": 3}]}")));
        wireMockServer.stubFor(post(urlEqualTo(API_PATH + "getTotal"))
            .willReturn(okJson("{\"DataFeed\": {\"Rows\": [{\"m_visits\": 3}]}}")));
        stubGetData();

        DataRequest request = client.newRequest(visitsQuery().build());
        request.fetchPage(1);
        request.getRowCount();
        request.getTotal();

        verify(1, postRequestedFor(urlEqualTo("/v3/data/getData")));
        verify(1, postRequestedFor(urlEqualTo("/v3/data/getRowCount")));
        verify(1, postRequestedFor(urlEqualTo("/v3/data/getTotal")));
    }
}
