package com.ryuqq.wsclient.adapter.wsdl.envelope;

import java.util.regex.Pattern;

/**
 * XML 요소/속성 이름 검증.
 *
 * <p>XMLStreamWriter는 이름을 그대로 출력하므로 작성 전에 이름을 검증합니다.
 * 접두사는 하나까지 허용합니다 ({@code prefix:local}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class XmlNames {

    private static final String NC_NAME = "[\\p{L}_][\\p{L}\\p{N}._\\-]*";
    private static final Pattern QUALIFIED_NAME = Pattern.compile("(?:" + NC_NAME + ":)?" + NC_NAME);
    private static final Pattern PREFIX = Pattern.compile(NC_NAME);

    private XmlNames() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 요소/속성 이름 검증.
     *
     * @param name 이름 (접두사 포함 가능)
     * @return 검증된 이름
     * @throws IllegalArgumentException XML 이름이 아닌 경우
     */
    static String requireQualifiedName(String name) {
        if (name == null || !QUALIFIED_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid XML name: " + name);
        }
        return name;
    }

    /**
     * 네임스페이스 접두사 검증.
     *
     * @param prefix 접두사
     * @return 검증된 접두사
     * @throws IllegalArgumentException XML 접두사가 아닌 경우
     */
    static String requirePrefix(String prefix) {
        if (prefix == null || !PREFIX.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Invalid XML namespace prefix: " + prefix);
        }
        return prefix;
    }
}
