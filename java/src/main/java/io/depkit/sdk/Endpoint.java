package io.depkit.sdk;

/**
 * DEP endpoints known to the SDK together with their default routes. Deployments talking to servers with a different
 * verb or path override the pairing through {@link Config.Builder#route(Endpoint, Route)}.
 */
public enum Endpoint {
    SESSION("GET", "/session"),
    ACCOUNT("GET", "/account"),
    DEFINE_PROFILE("POST", "/profile"),
    FETCH_PROFILE("GET", "/profile"),
    // Current documentation lists POST. Older servers and the depsim simulator only accept PUT.
    ASSIGN_PROFILE("PUT", "/profile/devices"),
    REMOVE_PROFILE("DELETE", "/profile/devices"),
    FETCH_DEVICES("POST", "/server/devices"),
    SYNC_DEVICES("POST", "/devices/sync"),
    DEVICE_DETAILS("POST", "/devices");

    private final Route defaultRoute;

    Endpoint(String method, String path) {
        this.defaultRoute = new Route(method, path);
    }

    public Route defaultRoute() {
        return defaultRoute;
    }
}
