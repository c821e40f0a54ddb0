package org.decide.authentication.shared.helpers;

import org.apache.http.client.utils.URIBuilder;

import java.net.URI;
import java.net.URISyntaxException;

public class ConstructUriHelper {

    private ConstructUriHelper() {}

    /**
     * Joins a scheme, an authority such as {@code example.org} or {@code 127.0.0.1:8000} and an
     * absolute path into a URI.
     */
    public static URI buildURI(String protocol, String domain, String path) {
        try {
            var uriBuilder = new URIBuilder(URI.create(protocol + "://" + domain));
            if (path != null) {
                uriBuilder.setPath(path.startsWith("/") ? path : "/" + path);
            }
            return uriBuilder.build();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Unable to build URI", e);
        }
    }
}
