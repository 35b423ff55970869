package com.flagship.bounty_ledger.security;

import org.springframework.http.HttpMethod;
import org.springframework.util.AntPathMatcher;

import java.util.List;

/**
 * Which requests are operator-only: task creation, generation and cancellation, verification,
 * settlement and every budget endpoint. Signature verification stays public.
 */
final class AdminRoutes {

    private static final AntPathMatcher MATCHER = new AntPathMatcher();

    private static final List<Route> ROUTES = List.of(
        new Route(HttpMethod.POST, "/api/tasks"),
        new Route(HttpMethod.POST, "/api/tasks/generate"),
        new Route(HttpMethod.POST, "/api/tasks/*/cancel"),
        new Route(HttpMethod.GET, "/api/submissions/pending"),
        new Route(HttpMethod.POST, "/api/submissions/*/verify"),
        new Route(HttpMethod.POST, "/api/submissions/*/payment"),
        new Route(HttpMethod.POST, "/api/verify/batch"),
        new Route(null, "/api/payments"),
        new Route(null, "/api/payments/**"),
        new Route(null, "/api/budget"),
        new Route(null, "/api/budget/**")
    );

    private static final String PUBLIC_SIGNATURE_CHECK = "/api/payments/verify/*";

    private AdminRoutes() {
    }

    static boolean isAdmin(String method, String path) {
        if (HttpMethod.GET.matches(method) && MATCHER.match(PUBLIC_SIGNATURE_CHECK, path)) {
            return false;
        }
        for (Route route : ROUTES) {
            if ((route.method == null || route.method.matches(method)) && MATCHER.match(route.pattern, path)) {
                return true;
            }
        }
        return false;
    }

    private record Route(HttpMethod method, String pattern) {
    }
}
