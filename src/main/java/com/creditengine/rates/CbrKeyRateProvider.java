package com.creditengine.rates;

import com.creditengine.common.exception.RateProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
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
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;

/**
 * Fetches the key rate from the Bank of Russia DailyInfo SOAP service.
 *
 * Requests the rates of the last 30 days and takes the most recent {@code KR/Rate}
 * element of the diffgram in the response.
 */
@Component
@ConditionalOnProperty(name = "credit-engine.rates.provider", havingValue = "cbr", matchIfMissing = true)
@Slf4j
public class CbrKeyRateProvider implements KeyRateProvider {

    static final String SOAP_ACTION = "http://web.cbr.ru/KeyRate";
    private static final MediaType SOAP_XML = MediaType.parseMediaType("application/soap+xml; charset=utf-8");
    private static final int LOOKBACK_DAYS = 30;

    private static final String ENVELOPE = """
        <?xml version="1.0" encoding="utf-8"?>
        <soap12:Envelope xmlns:soap12="http://www.w3.org/2003/05/soap-envelope">
            <soap12:Body>
                <KeyRate xmlns="http://web.cbr.ru/">
                    <fromDate>%s</fromDate>
                    <ToDate>%s</ToDate>
                </KeyRate>
            </soap12:Body>
        </soap12:Envelope>""";

    private final RestTemplate restTemplate;
    private final String serviceUrl;
    private final Clock clock;

    @Autowired
    public CbrKeyRateProvider(
            RestTemplateBuilder restTemplateBuilder,
            Clock clock,
            @Value("${credit-engine.rates.service-url:https://www.cbr.ru/DailyInfoWebServ/DailyInfo.asmx}") String serviceUrl,
            @Value("${credit-engine.rates.timeout:PT30S}") Duration timeout) {
        this(restTemplateBuilder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build(),
            serviceUrl, clock);
        log.info("CBR key rate provider initialized: serviceUrl={}, timeout={}", serviceUrl, timeout);
    }

    public CbrKeyRateProvider(RestTemplate restTemplate, String serviceUrl, Clock clock) {
        this.restTemplate = restTemplate;
        this.serviceUrl = serviceUrl;
        this.clock = clock;
    }

    @Override
    public BigDecimal getAnnualRate() {
        log.debug("Requesting key rate: url={}", serviceUrl);

        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                serviceUrl,
                HttpMethod.POST,
                new HttpEntity<>(buildRequest(), createHeaders()),
                String.class
            );
            body = response.getBody();
        } catch (RestClientException e) {
            throw new RateProviderException("Key rate request failed", e);
        }

        if (body == null || body.isBlank()) {
            throw new RateProviderException("Key rate response is empty");
        }

        BigDecimal rate = parseRate(body);
        log.info("Key rate received: rate={}", rate);
        return rate;
    }

    String buildRequest() {
        LocalDate today = LocalDate.now(clock);
        return String.format(ENVELOPE, today.minusDays(LOOKBACK_DAYS), today);
    }

    static BigDecimal parseRate(String xml) {
        Document document = parse(xml);

        NodeList records = document.getElementsByTagNameNS("*", "KR");
        if (records.getLength() == 0) {
            throw new RateProviderException("Key rate data not found in response");
        }

        Element latest = (Element) records.item(records.getLength() - 1);
        String text = childText(latest, "Rate");
        if (text == null || text.isBlank()) {
            throw new RateProviderException("Rate element missing or empty");
        }

        BigDecimal rate;
        try {
            rate = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new RateProviderException("Malformed rate value: " + text.trim(), e);
        }
        if (rate.signum() < 0) {
            throw new RateProviderException("Negative rate value: " + rate);
        }
        return rate;
    }

    private static Document parse(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new RateProviderException("Failed to parse key rate response", e);
        }
    }

    private static String childText(Element parent, String localName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && localName.equals(child.getLocalName())) {
                return child.getTextContent();
            }
        }
        return null;
    }

    private HttpHeaders createHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(SOAP_XML);
        headers.set("SOAPAction", SOAP_ACTION);
        return headers;
    }
}
