package com.webharvest.core.crawler.robots;

import java.net.URI;
import java.util.Map;

/**
 * 한 호스트의 robots 판정 함수. 한 번 만들어지면 바뀌지 않는다.
 * UA 별 그룹을 모두 보관하므로 같은 정책을 여러 UA 가 공유할 수 있다.
 */
public final class RobotsPolicy {

    private static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(Map.of(), true);

    private final Map<String, RobotsRules> groups;
    private final boolean allowAll;

    private RobotsPolicy(Map<String, RobotsRules> groups, boolean allowAll) {
        this.groups = groups;
        this.allowAll = allowAll;
    }

    public static RobotsPolicy parse(String robotsTxt) {
        return new RobotsPolicy(Map.copyOf(RobotsParser.parse(robotsTxt)), false);
    }

    /** 실패/없음 시 전체 허용 정책 */
    public static RobotsPolicy allowAll() {
        return ALLOW_ALL;
    }

    public boolean allows(URI url, String userAgent) {
        if (allowAll) return true;
        return RobotsParser.select(groups, userAgent).allows(RobotsMatcher.matchTarget(url));
    }

    public boolean isAllowAll() {
        return allowAll;
    }
}
