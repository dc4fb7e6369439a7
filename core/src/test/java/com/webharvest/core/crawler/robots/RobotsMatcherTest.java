package com.webharvest.core.crawler.robots;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class RobotsMatcherTest {

    @Test
    void prefix_match() {
        assertThat(RobotsMatcher.matches("/admin/users", "/admin")).isTrue();
        assertThat(RobotsMatcher.matches("/administrator", "/admin")).isTrue();
        assertThat(RobotsMatcher.matches("/public", "/admin")).isFalse();
    }

    @Test
    @DisplayName("'*' 와일드카드 + '$' 끝 고정")
    void wildcard_and_anchor() {
        assertThat(RobotsMatcher.matches("/files/a.pdf", "/*.pdf$")).isTrue();
        assertThat(RobotsMatcher.matches("/files/a.pdf?x=1", "/*.pdf$")).isFalse();
        assertThat(RobotsMatcher.matches("/a/b/c", "/a/*/c")).isTrue();
        assertThat(RobotsMatcher.matches("/exact", "/exact$")).isTrue();
        assertThat(RobotsMatcher.matches("/exact/more", "/exact$")).isFalse();
    }

    @Test
    void regex_metachars_are_literal() {
        assertThat(RobotsMatcher.matches("/a.b", "/a.b*")).isTrue();
        assertThat(RobotsMatcher.matches("/axb", "/a.b*")).isFalse();
    }

    @Test
    @DisplayName("우선순위 길이는 '*' 와 끝 '$' 를 세지 않는다")
    void effective_length() {
        assertThat(RobotsMatcher.effectiveLen("/a*b$")).isEqualTo(3);
        assertThat(RobotsMatcher.effectiveLen("/abc")).isEqualTo(4);
    }

    @Test
    @DisplayName("매칭 대상: raw path + query, 퍼센트 HEX 대문자")
    void match_target() {
        assertThat(RobotsMatcher.matchTarget(URI.create("https://ex.test/a%2fb?q=%e2%82%ac#frag")))
                .isEqualTo("/a%2Fb?q=%E2%82%AC");
        assertThat(RobotsMatcher.matchTarget(URI.create("https://ex.test"))).isEqualTo("/");
    }

    @Test
    void rule_is_normalized_the_same_way() {
        RobotsRules r = new RobotsRules().addDisallow("/a%2fb");
        assertThat(r.allows(RobotsMatcher.matchTarget(URI.create("https://ex.test/a%2Fb/c")))).isFalse();
    }
}
