package com.deepsearch.research.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @Test
    @DisplayName("스킴과 호스트는 소문자로 바꾸고 기본 포트와 프래그먼트는 제거한다")
    void normalizesIdentityParts() {
        assertThat(UrlNormalizer.normalize("HTTPS://Example.COM:443/Path/Page?x=1#section"))
                .contains("https://example.com/Path/Page?x=1");
        assertThat(UrlNormalizer.normalize("http://example.com:80"))
                .contains("http://example.com/");
    }

    @Test
    @DisplayName("기본값이 아닌 포트는 유지된다")
    void keepsCustomPort() {
        assertThat(UrlNormalizer.normalize("http://example.com:8080/a"))
                .contains("http://example.com:8080/a");
    }

    @Test
    @DisplayName("검색 엔진 리다이렉트 래퍼를 풀어낸다")
    void unwrapsRedirect() {
        String wrapped = "//duckduckgo.com/l/?uddg=https%3A%2F%2Fwww.example.org%2Farticle%3Fid%3D7&rut=abc123";

        assertThat(UrlNormalizer.normalize(wrapped))
                .contains("https://www.example.org/article?id=7");
    }

    @Test
    @DisplayName("같은 페이지의 두 표기는 같은 식별자로 정규화된다")
    void sameIdentity() {
        assertThat(UrlNormalizer.normalize("https://EXAMPLE.com/doc#top"))
                .isEqualTo(UrlNormalizer.normalize("https://example.com:443/doc"));
    }

    @Test
    @DisplayName("사용할 수 없는 URL은 거부된다")
    void rejectsUnusable() {
        assertThat(UrlNormalizer.normalize(null)).isEmpty();
        assertThat(UrlNormalizer.normalize("  ")).isEmpty();
        assertThat(UrlNormalizer.normalize("mailto:someone@example.com")).isEmpty();
        assertThat(UrlNormalizer.normalize("ftp://files.example.com/a")).isEmpty();
        assertThat(UrlNormalizer.normalize("/relative/path")).isEmpty();
    }

    @Test
    @DisplayName("도메인은 소문자 호스트다")
    void extractsDomain() {
        assertThat(UrlNormalizer.extractDomain("https://News.Example.com/a/b")).isEqualTo("news.example.com");
        assertThat(UrlNormalizer.extractDomain("not a url")).isNull();
    }
}
