package com.webharvest.core.crawler.robots;

import java.net.URI;

/** robots.txt 를 받아오는 협력자. 리다이렉트는 호출자(저장소)가 처리한다. */
public interface RobotsFetcher {

    /**
     * @param status   HTTP 상태, 네트워크 오류면 0
     * @param location 3xx 일 때 해석된 Location, 아니면 null
     */
    record Response(int status, String body, URI location, String error) {
        public static Response ok(int status, String body) {
            return new Response(status, body == null ? "" : body, null, null);
        }
        public static Response redirect(int status, URI location) {
            return new Response(status, "", location, null);
        }
        public static Response fail(String msg) {
            return new Response(0, "", null, msg);
        }
    }

    Response fetch(URI robotsTxtUri);
}
