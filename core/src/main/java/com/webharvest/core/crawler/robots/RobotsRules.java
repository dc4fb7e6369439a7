package com.webharvest.core.crawler.robots;

import java.util.ArrayList;
import java.util.List;

/** 한 User-agent 그룹의 Allow/Disallow 규칙 모음. 파싱이 끝나면 읽기 전용으로만 쓴다. */
public final class RobotsRules {

    /** 정규화된 규칙 한 줄. rank 는 우선순위 비교용 길이. */
    public record Rule(boolean allow, String pattern, int rank) {}

    private final List<Rule> rules = new ArrayList<>();

    public RobotsRules addAllow(String value) {
        return add(true, value);
    }

    public RobotsRules addDisallow(String value) {
        // Disallow: (빈값) 은 "전부 허용"이므로 규칙 없음과 같다
        return add(false, value);
    }

    private RobotsRules add(boolean allow, String value) {
        String norm = RobotsMatcher.normalizeRule(value);
        if (!norm.isEmpty()) rules.add(new Rule(allow, norm, RobotsMatcher.effectiveLen(norm)));
        return this;
    }

    public List<Rule> rules() {
        return List.copyOf(rules);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /** 매칭 규칙 중 가장 긴 것이 결정, 동률이면 Allow. 매칭 없으면 허용. */
    public boolean allows(String path) {
        Rule best = null;
        for (Rule r : rules) {
            if (!RobotsMatcher.matches(path, r.pattern())) continue;
            if (best == null
                    || r.rank() > best.rank()
                    || (r.rank() == best.rank() && r.allow() && !best.allow())) {
                best = r;
            }
        }
        return best == null || best.allow();
    }
}
