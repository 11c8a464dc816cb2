package com.eainde.extraction.chunk;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the priority sections of a tender by their headings.
 *
 * <p>A section runs from the line after its heading up to the next numbered
 * clause ({@code \n 7.}) or the end of the text, capped at
 * {@value #MAX_SECTION_CHARS} characters.</p>
 */
public final class SectionExtractor {

    static final int MAX_SECTION_CHARS = 5000;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;
    private static final String BODY = ".*?\\n(.*?)(?=\\n\\s*\\d+\\.|\\Z)";

    private static final Map<ContextSection, Pattern> HEADINGS = new EnumMap<>(ContextSection.class);

    static {
        HEADINGS.put(ContextSection.ELIGIBILITY,
                Pattern.compile("(?:Eligibility|Qualification|Who Can Bid)" + BODY, FLAGS));
        HEADINGS.put(ContextSection.FINANCIAL,
                Pattern.compile("(?:Financial Requirements?|EMD|Tender Fee)" + BODY, FLAGS));
        HEADINGS.put(ContextSection.SCOPE_OF_WORK,
                Pattern.compile("(?:Scope of Work|Technical Specs?)" + BODY, FLAGS));
        HEADINGS.put(ContextSection.TERMS_CONDITIONS,
                Pattern.compile("(?:Terms and Conditions|Special Conditions)" + BODY, FLAGS));
        HEADINGS.put(ContextSection.TIMELINE,
                Pattern.compile("(?:Important Dates?|Timeline|Schedule)" + BODY, FLAGS));
    }

    private SectionExtractor() {
    }

    /**
     * @return section key ({@link ContextSection#key()}) to section text, for sections found
     */
    public static Map<String, String> extract(String text) {
        Map<String, String> sections = new LinkedHashMap<>();
        if (text == null || text.isBlank()) return sections;

        for (Map.Entry<ContextSection, Pattern> entry : HEADINGS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(text);
            if (matcher.find()) {
                String body = matcher.group(1).strip();
                if (body.length() > MAX_SECTION_CHARS) {
                    body = body.substring(0, MAX_SECTION_CHARS);
                }
                sections.put(entry.getKey().key(), body);
            }
        }
        return sections;
    }
}
