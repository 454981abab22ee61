package com.ragsync.collect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.ragsync.ingest.RawDocument;
import com.ragsync.runtime.AppConfig.StatuteSourceConfig;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class StatuteApiCollectorTest {
    private static final String LAW_LIST = """
            <?xml version="1.0" encoding="UTF-8"?>
            <DataRoot>
              <Result><Code>0</Code><Message/></Result>
              <ApplData>
                <Category>1</Category>
                <LawNameListInfo>
                  <LawId>340AC0000000033</LawId>
                  <LawName>所得税法</LawName>
                  <LawNo>昭和四十年法律第三十三号</LawNo>
                </LawNameListInfo>
                <LawNameListInfo>
                  <LawId>340CO0000000096</LawId>
                  <LawName>所得税法施行令</LawName>
                  <LawNo>昭和四十年政令第九十六号</LawNo>
                </LawNameListInfo>
                <LawNameListInfo>
                  <LawId>340AC0000000034</LawId>
                  <LawName>法人税法</LawName>
                  <LawNo>昭和四十年法律第三十四号</LawNo>
                </LawNameListInfo>
              </ApplData>
            </DataRoot>
            """;
    private static final String INCOME_TAX_ACT = """
            <?xml version="1.0" encoding="UTF-8"?>
            <DataRoot>
              <Result><Code>0</Code><Message/></Result>
              <ApplData>
                <LawId>340AC0000000033</LawId>
                <LawFullText>
                  <Law>
                    <LawNum>昭和四十年法律第三十三号</LawNum>
                    <LawBody>
                      <LawTitle>所得税法</LawTitle>
                      <MainProvision>
                        <Article>
                          <ArticleCaption>（趣旨）</ArticleCaption>
                          <ArticleTitle>第一条</ArticleTitle>
                          <Paragraph><ParagraphSentence><Sentence>この法律は、所得税について定める。</Sentence></ParagraphSentence></Paragraph>
                        </Article>
                      </MainProvision>
                    </LawBody>
                  </Law>
                </LawFullText>
              </ApplData>
            </DataRoot>
            """;
    private static final String ERROR_RESULT = """
            <DataRoot><Result><Code>1</Code><Message>not found</Message></Result></DataRoot>
            """;

    private MockWebServer server;
    private final Map<String, MockResponse> responses = new HashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                MockResponse response = responses.get(request.getPath());
                return response != null ? response : new MockResponse().setResponseCode(404);
            }
        });
        server.start();
        responses.put("/api/1/lawlists/1", xml(LAW_LIST));
        responses.put("/api/1/lawdata/340AC0000000033", xml(INCOME_TAX_ACT));
        responses.put("/api/1/lawdata/340AC0000000034", xml(ERROR_RESULT));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldCollectBestMatchingLawPerKeyword() throws Exception {
        CollectorResult result = collector(List.of("所得税法")).collect();

        assertTrue(result.complete());
        assertEquals(1, result.documents().size());
        RawDocument law = result.documents().get(0);
        assertEquals("egov", law.source());
        assertEquals("所得税法", law.title());
        assertEquals("https://laws.e-gov.go.jp/law/340AC0000000033", law.url());
        assertEquals(Map.of("law_id", "340AC0000000033", "law_no", "昭和四十年法律第三十三号"), law.extra());
        assertEquals("昭和四十年法律第三十三号\n所得税法\n（趣旨）\n第一条\nこの法律は、所得税について定める。", law.content());
    }

    @Test
    void shouldCountLawsReturningErrorResultAsFailures() throws Exception {
        CollectorResult result = collector(List.of("所得税法", "法人税法")).collect();

        assertEquals(1, result.documents().size());
        assertEquals(1, result.failures());
        assertFalse(result.complete());
    }

    @Test
    void shouldFailWholeCollectorWhenLawListIsUnavailable() {
        responses.remove("/api/1/lawlists/1");

        assertThrows(IOException.class, () -> collector(List.of("所得税法")).collect());
    }

    @Test
    void shouldParseLawListEntries() {
        List<LawListing> laws = StatuteApiCollector.parseLawList(LAW_LIST);

        assertEquals(3, laws.size());
        assertEquals(new LawListing("340CO0000000096", "所得税法施行令", "昭和四十年政令第九十六号"), laws.get(1));
    }

    @Test
    void shouldReturnNullForErrorResult() {
        assertNull(StatuteApiCollector.parseLawText(ERROR_RESULT));
    }

    private StatuteApiCollector collector(List<String> keywords) {
        StatuteSourceConfig config = new StatuteSourceConfig();
        config.setEnabled(true);
        config.setBaseUrl(server.url("/api/1/").toString());
        config.setKeywords(keywords);
        config.setDelaySeconds(0);
        PageFetcher fetcher = new PageFetcher(new OkHttpClient(), "rag-sync-test", 0, Duration.ZERO, duration -> { });
        return new StatuteApiCollector(config, fetcher, duration -> { });
    }

    private static MockResponse xml(String body) {
        return new MockResponse().setHeader("Content-Type", "application/xml; charset=utf-8").setBody(body);
    }
}
