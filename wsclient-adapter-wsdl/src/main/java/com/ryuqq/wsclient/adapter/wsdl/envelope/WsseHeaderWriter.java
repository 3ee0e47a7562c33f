package com.ryuqq.wsclient.adapter.wsdl.envelope;

import com.ryuqq.wsclient.core.config.Credentials;
import com.ryuqq.wsclient.core.config.WsseSettings;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Base64;

/**
 * WS-Security 헤더 작성기.
 *
 * <p>UsernameToken (PasswordText / PasswordDigest)과 Timestamp를 작성합니다.</p>
 *
 * <p><strong>PasswordDigest:</strong> Base64(SHA-1(nonce + created + password))</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WsseHeaderWriter {

    public static final String WSSE_NAMESPACE =
        "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-secext-1.0.xsd";
    public static final String WSU_NAMESPACE =
        "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-utility-1.0.xsd";
    public static final String PASSWORD_TEXT_TYPE =
        "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-username-token-profile-1.0#PasswordText";
    public static final String PASSWORD_DIGEST_TYPE =
        "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-username-token-profile-1.0#PasswordDigest";
    public static final String BASE64_ENCODING_TYPE =
        "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-soap-message-security-1.0#Base64Binary";

    static final long TIMESTAMP_TTL_SECONDS = 60;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public WsseHeaderWriter(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * Security 헤더 필요 여부.
     *
     * @param wsse WS-Security 설정 (nullable)
     * @return 자격 증명 또는 Timestamp 설정이 있으면 true
     */
    public boolean isRequired(WsseSettings wsse) {
        return wsse != null && (wsse.hasCredentials() || wsse.isTimestamp());
    }

    /**
     * Security 헤더를 문자열로 작성.
     *
     * @param wsse WS-Security 설정
     * @return {@code wsse:Security} 요소 또는 설정이 없으면 빈 문자열
     */
    public String write(WsseSettings wsse) {
        if (!isRequired(wsse)) {
            return "";
        }
        StringWriter buffer = new StringWriter();
        try {
            XMLStreamWriter out = XMLOutputFactory.newFactory().createXMLStreamWriter(buffer);
            write(out, wsse);
            out.flush();
            out.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Unable to write WS-Security header", e);
        }
        return buffer.toString();
    }

    /**
     * 열린 XMLStreamWriter에 Security 헤더 작성.
     *
     * @param out 대상 writer
     * @param wsse WS-Security 설정 (필요 없으면 아무것도 쓰지 않음)
     * @throws XMLStreamException 작성 실패
     */
    public void write(XMLStreamWriter out, WsseSettings wsse) throws XMLStreamException {
        if (!isRequired(wsse)) {
            return;
        }
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        out.writeStartElement("wsse:Security");
        out.writeNamespace("wsse", WSSE_NAMESPACE);
        out.writeNamespace("wsu", WSU_NAMESPACE);
        if (wsse.isTimestamp()) {
            out.writeStartElement("wsu:Timestamp");
            out.writeAttribute("wsu:Id", "Timestamp-1");
            writeText(out, "wsu:Created", format(now));
            writeText(out, "wsu:Expires", format(now.plusSeconds(TIMESTAMP_TTL_SECONDS)));
            out.writeEndElement();
        }
        if (wsse.hasCredentials()) {
            writeUsernameToken(out, wsse.getCredentials(), wsse.isDigest(), format(now));
        }
        out.writeEndElement();
    }

    private void writeUsernameToken(XMLStreamWriter out, Credentials credentials, boolean digest,
                                    String created) throws XMLStreamException {
        out.writeStartElement("wsse:UsernameToken");
        out.writeAttribute("wsu:Id", "UsernameToken-1");
        writeText(out, "wsse:Username", credentials.username());
        if (digest) {
            byte[] nonce = new byte[16];
            random.nextBytes(nonce);
            out.writeStartElement("wsse:Password");
            out.writeAttribute("Type", PASSWORD_DIGEST_TYPE);
            out.writeCharacters(passwordDigest(nonce, created, credentials.password()));
            out.writeEndElement();
            out.writeStartElement("wsse:Nonce");
            out.writeAttribute("EncodingType", BASE64_ENCODING_TYPE);
            out.writeCharacters(Base64.getEncoder().encodeToString(nonce));
            out.writeEndElement();
            writeText(out, "wsu:Created", created);
        } else {
            out.writeStartElement("wsse:Password");
            out.writeAttribute("Type", PASSWORD_TEXT_TYPE);
            out.writeCharacters(credentials.password());
            out.writeEndElement();
        }
        out.writeEndElement();
    }

    private static void writeText(XMLStreamWriter out, String name, String text) throws XMLStreamException {
        out.writeStartElement(name);
        out.writeCharacters(text);
        out.writeEndElement();
    }

    /**
     * PasswordDigest 계산.
     *
     * @param nonce 원본 nonce 바이트
     * @param created wsu:Created 값
     * @param password 평문 비밀번호
     * @return Base64 인코딩된 SHA-1 digest
     */
    public static String passwordDigest(byte[] nonce, String created, String password) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            sha1.update(nonce);
            sha1.update(created.getBytes(StandardCharsets.UTF_8));
            sha1.update(password.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(sha1.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }

    private static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
