package com.nhnacademy.booknotionsync.catalog.component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nhnacademy.booknotionsync.exception.CatalogApiException;
import com.nhnacademy.booknotionsync.exception.MalformedResponseException;
import com.nhnacademy.booknotionsync.util.BookSyncUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 알라딘 응답 본문(JSONP / JSON / XML)을 평평한 key-value 목록으로 바꾼다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseDecoder {

    private static final String JSONP_PREFIX = "callback(";
    private static final String ITEM = "item";

    private final ObjectMapper objectMapper;

    /**
     * JSON(또는 JSONP) 응답을 해석한다.
     * 형식 금지 오류이거나 JSON 자체가 깨져 있으면 예외 대신 RETRY_AS_XML 을 돌려준다.
     *
     * @throws CatalogApiException 형식 금지가 아닌 알라딘 오류 응답
     */
    public DecodeResult decode(String rawBody) {
        String json = stripJsonp(rawBody);

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.info("[ResponseDecoder] JSON 파싱 실패 -> XML 재시도. cause={}", e.getOriginalMessage());
            return DecodeResult.retryAsXml();
        }

        if (root == null || !root.isObject()) {
            log.info("[ResponseDecoder] JSON 객체가 아닌 응답 -> XML 재시도");
            return DecodeResult.retryAsXml();
        }

        if (root.has("errorCode") || root.has("errorMessage")) {
            String code = root.path("errorCode").asText("");
            String message = root.path("errorMessage").asText("알 수 없는 오류");
            if (isFormatForbidden(message)) {
                log.info("[ResponseDecoder] JSON 형식이 허용되지 않음 -> XML 재시도. code={}", code);
                return DecodeResult.retryAsXml();
            }
            throw new CatalogApiException(code, message);
        }

        JsonNode items = root.get(ITEM);
        if (items == null || !items.isArray()) {
            return DecodeResult.records(Collections.emptyList());
        }

        List<Map<String, String>> records = new ArrayList<>();
        for (JsonNode item : items) {
            if (item.isObject()) {
                records.add(flatten(item));
            }
        }
        return DecodeResult.records(records);
    }

    /**
     * XML 응답에서 모든 item 요소를 꺼낸다. 자식 요소는 네임스페이스를 뗀 로컬 이름으로 저장한다.
     *
     * @throws MalformedResponseException XML 파싱 실패
     * @throws CatalogApiException        루트가 error 요소인 경우
     */
    public List<Map<String, String>> decodeXml(String rawBody) {
        Document document = parseXml(rawBody == null ? "" : rawBody.trim());
        Element root = document.getDocumentElement();

        if ("error".equals(localName(root))) {
            throw new CatalogApiException(childText(root, "errorCode"), childText(root, "errorMessage"));
        }

        NodeList itemNodes = document.getElementsByTagNameNS("*", ITEM);
        List<Map<String, String>> records = new ArrayList<>();
        for (int i = 0; i < itemNodes.getLength(); i++) {
            Map<String, String> record = new LinkedHashMap<>();
            NodeList children = itemNodes.item(i).getChildNodes();
            for (int j = 0; j < children.getLength(); j++) {
                Node child = children.item(j);
                if (child.getNodeType() == Node.ELEMENT_NODE) {
                    String text = child.getTextContent();
                    record.put(localName(child), text == null ? "" : text.trim());
                }
            }
            if (!record.isEmpty()) {
                records.add(record);
            }
        }
        return records;
    }

    // callback( ... ) 또는 callback( ... ); 형태 제거
    String stripJsonp(String rawBody) {
        if (rawBody == null) return "";
        String body = rawBody.trim();
        if (!body.startsWith(JSONP_PREFIX)) return body;

        body = body.substring(JSONP_PREFIX.length());
        if (body.endsWith(");")) {
            body = body.substring(0, body.length() - 2);
        } else if (body.endsWith(")")) {
            body = body.substring(0, body.length() - 1);
        }
        return body.trim();
    }

    private boolean isFormatForbidden(String message) {
        return message.contains("금지") || message.toLowerCase().contains("forbidden");
    }

    // 문자열/숫자/불리언은 문자열로, null 은 빈 문자열로, 중첩 객체와 배열은 버림
    private Map<String, String> flatten(JsonNode item) {
        Map<String, String> record = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                record.put(field.getKey(), "");
            } else if (value.isValueNode()) {
                record.put(field.getKey(), value.asText());
            }
        }
        return record;
    }

    private Document parseXml(String body) {
        try {
            DocumentBuilder builder = secureFactory().newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(body)));
        } catch (SAXException | IOException | ParserConfigurationException e) {
            log.warn("[ResponseDecoder] XML 파싱 오류. body={}", BookSyncUtils.truncate(body, 500));
            throw new MalformedResponseException("알라딘 XML 응답을 해석할 수 없습니다: " + e.getMessage(), e);
        }
    }

    private DocumentBuilderFactory secureFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        // XXE 차단
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    private String localName(Node node) {
        String name = node.getLocalName();
        if (name != null) return name;
        String nodeName = node.getNodeName();
        int colon = nodeName.indexOf(':');
        return colon >= 0 ? nodeName.substring(colon + 1) : nodeName;
    }

    private String childText(Element parent, String name) {
        NodeList nodes = parent.getElementsByTagNameNS("*", name);
        if (nodes.getLength() == 0) return "";
        String text = nodes.item(0).getTextContent();
        return text == null ? "" : text.trim();
    }
}
