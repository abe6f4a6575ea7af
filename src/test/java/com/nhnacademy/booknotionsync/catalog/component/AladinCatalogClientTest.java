package com.nhnacademy.booknotionsync.catalog.component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nhnacademy.booknotionsync.catalog.dto.BookRecord;
import com.nhnacademy.booknotionsync.catalog.dto.RecordSource;
import com.nhnacademy.booknotionsync.exception.BookNotFoundException;
import com.nhnacademy.booknotionsync.exception.CatalogApiException;
import com.nhnacademy.booknotionsync.exception.ConfigException;
import com.nhnacademy.booknotionsync.exception.MalformedResponseException;
import com.nhnacademy.booknotionsync.exception.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * AladinCatalogClient 테스트 (외부 통신 없음)
 * - WebClient 에 모킹한 ExchangeFunction 을 꽂아 응답과 호출 횟수를 제어한다.
 */
class AladinCatalogClientTest {

    private static final String API_KEY = "ttb-test-key";

    private static final String SEARCH_JSON = """
            {"version":"20131101","item":[
              {"title":"클린 코드","author":"로버트 C. 마틴","publisher":"인사이트","pubDate":"2013-12-24",
               "cover":"https://image.aladin.co.kr/cover.jpg","isbn":"8966260772","isbn13":"9788966260775",
               "link":"https://www.aladin.co.kr/shop/wproduct.aspx?ItemId=34083680","description":"애자일 소프트웨어 장인 정신"},
              {"title":"클린 코더","author":"로버트 C. 마틴","isbn13":"9788966261079"}
            ]}
            """;

    private static final String SEARCH_XML = """
            <?xml version="1.0" encoding="utf-8"?>
            <object xmlns="http://www.aladin.co.kr/ttb/apiguide.aspx">
              <item itemId="34083680">
                <title>클린 코드</title>
                <author>로버트 C. 마틴</author>
                <pubDate>2013-12-24</pubDate>
                <isbn>8966260772</isbn>
                <isbn13>9788966260775</isbn13>
                <cover></cover>
              </item>
            </object>
            """;

    private static final String FORBIDDEN_JSON = """
            {"errorCode":8,"errorMessage":"JS 출력은 금지된 형식입니다. XML로 요청해주세요."}
            """;

    private ExchangeFunction exchangeFunction;
    private AladinCatalogClient client;

    @BeforeEach
    void setUp() {
        exchangeFunction = mock(ExchangeFunction.class);
        WebClient webClient = WebClient.builder()
                .exchangeFunction(exchangeFunction)
                .build();

        client = new AladinCatalogClient(webClient, new ResponseDecoder(new ObjectMapper()));
        ReflectionTestUtils.setField(client, "searchUrl", "http://fake.aladin/ttb/api/ItemSearch.aspx");
        ReflectionTestUtils.setField(client, "lookupUrl", "http://fake.aladin/ttb/api/ItemLookUp.aspx");
        ReflectionTestUtils.setField(client, "apiVersion", "20131101");
        ReflectionTestUtils.setField(client, "timeoutSeconds", 5L);
    }

    // --------- helpers ---------

    private static Mono<ClientResponse> ok(String contentType, String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .body(body)
                .build());
    }

    private static Mono<ClientResponse> okJson(String body) {
        return ok(MediaType.APPLICATION_JSON_VALUE, body);
    }

    private static Mono<ClientResponse> okXml(String body) {
        return ok("text/xml;charset=utf-8", body);
    }

    private List<ClientRequest> capturedRequests(int expectedCalls) {
        ArgumentCaptor<ClientRequest> captor = ArgumentCaptor.forClass(ClientRequest.class);
        verify(exchangeFunction, times(expectedCalls)).exchange(captor.capture());
        return captor.getAllValues();
    }

    @Nested
    @DisplayName("search()")
    class SearchTests {

        @Test
        @DisplayName("JSON 응답: item 마다 BookRecord 를 만들고 고정 파라미터로 요청한다")
        void json_mapsRecords() {
            when(exchangeFunction.exchange(any(ClientRequest.class))).thenReturn(okJson(SEARCH_JSON));

            List<BookRecord> books = client.search("클린 코드", API_KEY, 10);

            assertThat(books).hasSize(2);
            BookRecord first = books.get(0);
            assertThat(first.title()).isEqualTo("클린 코드");
            assertThat(first.publisher()).isEqualTo("인사이트");
            assertThat(first.pubDate()).isEqualTo("2013-12-24");
            assertThat(first.isbn10()).isEqualTo("8966260772");
            assertThat(first.isbn13()).isEqualTo("9788966260775");
            assertThat(first.coverImageUrl()).isEqualTo("https://image.aladin.co.kr/cover.jpg");
            assertThat(first.detailLink()).contains("ItemId=34083680");
            assertThat(first.source()).isEqualTo(RecordSource.SEARCH);

            assertThat(books.get(1).publisher()).as("없는 키는 빈 문자열").isEmpty();

            ClientRequest request = capturedRequests(1).get(0);
            assertThat(request.method()).isEqualTo(HttpMethod.GET);
            assertThat(request.url().getPath()).isEqualTo("/ttb/api/ItemSearch.aspx");
            assertThat(request.url().getQuery())
                    .contains("ttbkey=" + API_KEY)
                    .contains("Query=클린 코드")
                    .contains("QueryType=Keyword")
                    .contains("MaxResults=10")
                    .contains("SearchTarget=Book")
                    .contains("output=js")
                    .contains("Version=20131101")
                    .contains("Cover=Big");
        }

        @Test
        @DisplayName("JSONP 응답도 그대로 해석한다")
        void jsonp_mapsRecords() {
            when(exchangeFunction.exchange(any(ClientRequest.class)))
                    .thenReturn(ok("text/javascript", "callback(" + SEARCH_JSON + ");"));

            List<BookRecord> books = client.search("클린 코드", API_KEY, 10);

            assertThat(books).extracting(BookRecord::title).containsExactly("클린 코드", "클린 코더");
        }

        @Test
        @DisplayName("형식 금지: JSON 1회 + XML 1회, 총 2번만 호출하고 XML 결과를 반환한다")
        void forbiddenFormat_retriesOnceAsXml() {
            when(exchangeFunction.exchange(any(ClientRequest.class)))
                    .thenReturn(okJson(FORBIDDEN_JSON), okXml(SEARCH_XML));

            List<BookRecord> books = client.search("클린 코드", API_KEY, 10);

            assertThat(books).hasSize(1);
            assertThat(books.get(0).title()).isEqualTo("클린 코드");
            assertThat(books.get(0).isbn13()).isEqualTo("9788966260775");
            assertThat(books.get(0).coverImageUrl()).isEmpty();

            List<ClientRequest> requests = capturedRequests(2);
            assertThat(requests.get(0).url().getQuery()).contains("output=js");
            assertThat(requests.get(1).url().getQuery())
                    .contains("output=xml")
                    .as("XML 재시도는 같은 요청이어야 함")
                    .contains("Query=클린 코드")
                    .contains("ttbkey=" + API_KEY);
        }

        @Test
        @DisplayName("JSON 파싱 실패도 XML 로 한 번 재시도한다")
        void unparsableJson_retriesAsXml() {
            when(exchangeFunction.exchange(any(ClientRequest.class)))
                    .thenReturn(ok("text/html", "<html>oops</html>"), okXml(SEARCH_XML));

            assertThat(client.search("클린 코드", API_KEY, 10)).hasSize(1);
            verify(exchangeFunction, times(2)).exchange(any(ClientRequest.class));
        }

        @Test
        @DisplayName("XML 재시도 결과도 깨져 있으면 더 재시도하지 않고 MalformedResponseException")
        void xmlRetryFails_noFurtherRetry() {
            when(exchangeFunction.exchange(any(ClientRequest.class)))
                    .thenReturn(okJson(FORBIDDEN_JSON), okXml("<object><item>"));

            assertThatThrownBy(() -> client.search("클린 코드", API_KEY, 10))
                    .isInstanceOf(MalformedResponseException.class);
            verify(exchangeFunction, times(2)).exchange(any(ClientRequest.class));
        }

        @Test
        @DisplayName("형식 금지가 아닌 오류는 XML 재시도 없이 바로 실패한다")
        void otherCatalogError_noRetry() {
            when(exchangeFunction.exchange(any(ClientRequest.class)))
                    .thenReturn(okJson("{\"errorCode\":1,\"errorMessage\":\"잘못된 TTBKey 입니다.\"}"));

            assertThatThrownBy(() -> client.search("클린 코드", API_KEY, 10))
                    .isInstanceOf(CatalogApiException.class);
            verify(exchangeFunction, times(1)).exchange(any(ClientRequest.class));
        }

        @Test
        @DisplayName("API 키가 없으면 요청 없이 ConfigException")
        void missingApiKey_noRequest() {
            assertThatThrownBy(() -> client.search("클린 코드", "", 10)).isInstanceOf(ConfigException.class);
            assertThatThrownBy(() -> client.search("클린 코드", null, 10)).isInstanceOf(ConfigException.class);

            verifyNoInteractions(exchangeFunction);
        }

        @Test
        @DisplayName("빈 검색어는 IllegalArgumentException")
        void blankKeyword_rejected() {
            assertThatThrownBy(() -> client.search("  ", API_KEY, 10)).isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(exchangeFunction);
        }

        @Test
        @DisplayName("검색어의 '+', '&' 같은 예약 문자도 퍼센트 인코딩해서 보낸다")
        void reservedCharacters_encodedInQuery() {
            when(exchangeFunction.exchange(any(ClientRequest.class))).thenReturn(okJson("{}"), okJson("{}"));

            client.search("C++ 프로그래밍", API_KEY, 10);
            client.search("R&D 입문", API_KEY, 10);

            List<ClientRequest> requests = capturedRequests(2);
            assertThat(requests.get(0).url().getRawQuery())
                    .contains("Query=C%2B%2B%20")
                    .doesNotContain("C++");
            assertThat(requests.get(0).url().getQuery()).contains("Query=C++ 프로그래밍");
            assertThat(requests.get(1).url().getRawQuery())
                    .contains("Query=R%26D%20")
                    .contains("&QueryType=Keyword");
        }

        @Test
        @DisplayName("MaxResults 는 1~100 으로 맞춘다")
        void maxResults_clamped() {
            when(exchangeFunction.exchange(any(ClientRequest.class))).thenReturn(okJson("{}"), okJson("{}"));

            client.search("a", API_KEY, 500);
            client.search("a", API_KEY, 0);

            List<ClientRequest> requests = capturedRequests(2);
            assertThat(requests.get(0).url().getQuery()).contains("MaxResults=100");
            assertThat(requests.get(1).url().getQuery()).contains("MaxResults=1");
        }

        @Test
        @DisplayName("item 이 없으면 빈 목록 (오류 아님)")
        void noItems_emptyList() {
            when(exchangeFunction.exchange(any(ClientRequest.class))).thenReturn(okJson("{\"totalResults\":0}"));

            assertThat(client.search("없는책", API_KEY, 10)).isEmpty();
        }

        @Test
        @DisplayName("HTTP 5xx 는 재시도 없이 TransportException")
        void httpError_transportException() {
            when(exchangeFunction.exchange(any(ClientRequest.class)))
                    .thenReturn(Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).body("down").build()));

            assertThatThrownBy(() -> client.search("클린 코드", API_KEY, 10))
                    .isInstanceOf(TransportException.class)
                    .satisfies(e -> assertThat(((TransportException) e).getStatusCode()).isEqualTo(503));
            verify(exchangeFunction, times(1)).exchange(any(ClientRequest.class));
        }

        @Test
        @DisplayName("네트워크 오류는 원인을 감싼 TransportException")
        void networkError_transportException() {
            when(exchangeFunction.exchange(any(ClientRequest.class)))
                    .thenReturn(Mono.error(new WebClientRequestException(
                            new IOException("connection refused"),
                            HttpMethod.GET,
                            URI.create("http://fake.aladin/ttb/api/ItemSearch.aspx"),
                            new HttpHeaders())));

            assertThatThrownBy(() -> client.search("클린 코드", API_KEY, 10))
                    .isInstanceOf(TransportException.class)
                    .hasCauseInstanceOf(Exception.class);
            verify(exchangeFunction, times(1)).exchange(any(ClientRequest.class));
        }
    }

    @Nested
    @DisplayName("lookup()")
    class LookupTests {

        @Test
        @DisplayName("결과가 없으면 BookNotFoundException")
        void zeroItems_notFound() {
            when(exchangeFunction.exchange(any(ClientRequest.class))).thenReturn(okJson("{\"item\":[]}"));

            assertThatThrownBy(() -> client.lookup("9788966260775", API_KEY))
                    .isInstanceOf(BookNotFoundException.class)
                    .hasMessageContaining("9788966260775");
        }

        @Test
        @DisplayName("두 건이 오면 첫 번째만 사용한다")
        void twoItems_usesFirst() {
            when(exchangeFunction.exchange(any(ClientRequest.class))).thenReturn(okJson(SEARCH_JSON));

            BookRecord book = client.lookup("9788966260775", API_KEY);

            assertThat(book.title()).isEqualTo("클린 코드");
            assertThat(book.source()).isEqualTo(RecordSource.LOOKUP);
        }

        @Test
        @DisplayName("ISBN 의 하이픈을 제거해 ItemLookUp 으로 요청한다")
        void cleansIsbn_andUsesLookupEndpoint() {
            when(exchangeFunction.exchange(any(ClientRequest.class))).thenReturn(okJson(SEARCH_JSON));

            client.lookup("978-89-6626-077-5", API_KEY);

            ClientRequest request = capturedRequests(1).get(0);
            assertThat(request.url().getPath()).isEqualTo("/ttb/api/ItemLookUp.aspx");
            assertThat(request.url().getQuery())
                    .contains("itemIdType=ISBN")
                    .contains("ItemId=9788966260775")
                    .contains("output=js");
        }

        @Test
        @DisplayName("형식 금지면 XML 로 한 번 재시도해 상세 정보를 가져온다")
        void forbiddenFormat_xmlFallback() {
            when(exchangeFunction.exchange(any(ClientRequest.class)))
                    .thenReturn(ok("text/javascript", "callback(" + FORBIDDEN_JSON.trim() + ")"), okXml(SEARCH_XML));

            BookRecord book = client.lookup("9788966260775", API_KEY);

            assertThat(book.isbn10()).isEqualTo("8966260772");
            verify(exchangeFunction, times(2)).exchange(any(ClientRequest.class));
        }

        @Test
        @DisplayName("API 키나 ISBN 이 비어 있으면 요청하지 않는다")
        void invalidInput_noRequest() {
            assertThatThrownBy(() -> client.lookup("9788966260775", " ")).isInstanceOf(ConfigException.class);
            assertThatThrownBy(() -> client.lookup(" - ", API_KEY)).isInstanceOf(IllegalArgumentException.class);

            verifyNoInteractions(exchangeFunction);
        }
    }
}
