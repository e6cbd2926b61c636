package io.trading.rofex.client.config;

import java.net.URI;

/**
 * Gateway environments.
 * REMARKET is the demo environment used for testing, LIVE is production.
 */
public enum Environment {
    REMARKET(
        "https://api.remarkets.primary.com.ar/",
        "wss://api.remarkets.primary.com.ar/",
        "PBCP"
    ),
    LIVE(
        "https://api.primary.com.ar/",
        "wss://api.primary.com.ar/",
        "api"
    );

    private final URI restUri;
    private final URI streamUri;
    private final String proprietary;

    Environment(String restUrl, String streamUrl, String proprietary) {
        this.restUri = URI.create(restUrl);
        this.streamUri = URI.create(streamUrl);
        this.proprietary = proprietary;
    }

    public URI getRestUri() {
        return restUri;
    }

    public URI getStreamUri() {
        return streamUri;
    }

    /**
     * Default proprietary used for order status and cancel requests.
     */
    public String getProprietary() {
        return proprietary;
    }
}
