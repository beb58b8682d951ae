package org.analytics.dataquery.rest.interfaces;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Raw HTTP response as returned by an {@link HttpTransport}.
 */
@AllArgsConstructor
@Getter
@ToString
public class TransportResponse {

    private final int statusCode;
    /** Reason phrase of the status line; may be null or empty (HTTP/2). */
    private final String reasonPhrase;
    /** Response body decoded as UTF-8, empty when the response had no entity. */
    private final String body;

}
