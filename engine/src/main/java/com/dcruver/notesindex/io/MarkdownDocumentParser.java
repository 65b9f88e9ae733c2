package com.dcruver.notesindex.io;

import com.dcruver.notesindex.tags.TagPath;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses markdown documents: YAML frontmatter, {@code [[wiki links]]},
 * inline {@code #hierarchical/tags}, title and word count.
 *
 * Parsing is a pure function of the text. A malformed frontmatter block does
 * not fail the parse: the whole text becomes the body so the document stays
 * searchable, and the problem is reported on the result.
 */
@Component
@Slf4j
public class MarkdownDocumentParser {

    public static final int WORDS_PER_MINUTE = 200;

    private static final Pattern FRONTMATTER_OPEN = Pattern.compile("^---\\s*$");
    private static final Pattern FRONTMATTER_CLOSE = Pattern.compile("^(?:---|\\.\\.\\.)\\s*$");
    private static final Pattern HEADING_1 = Pattern.compile("^#[ \\t]+(.+?)(?:[ \\t]+#+)?[ \\t]*$");
    private static final Pattern FENCE = Pattern.compile("^\\s{0,3}(```|~~~)");
    private static final Pattern INLINE_CODE = Pattern.compile("`[^`]*`");
    private static final Pattern WIKI_LINK = Pattern.compile("(!?)\\[\\[([^\\[\\]\\n]+?)\\]\\]");
    private static final Pattern INLINE_TAG =
        Pattern.compile("(?<![\\p{L}\\p{N}_#&/\\\\])#([\\p{L}_][\\p{L}\\p{N}_\\-/]*)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})");
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,\\s]+");

    private static final int MAX_CONTEXT_LENGTH = 200;

    private final YAMLMapper yamlMapper = new YAMLMapper();

    /**
     * Parse a whole document. Never throws for malformed input.
     */
    public ParsedDocument parse(String text) {
        String content = stripBom(text == null ? "" : text);

        FrontmatterBlock block;
        String problem = null;
        try {
            block = splitFrontmatter(content);
        } catch (DocumentParseException e) {
            log.debug("Malformed frontmatter, indexing full text as body: {}", e.getMessage());
            problem = e.getMessage();
            block = new FrontmatterBlock(Frontmatter.EMPTY, content);
        }

        Frontmatter frontmatter = block.frontmatter();
        String body = block.body();
        List<String> scanLines = maskCode(body);

        String title = frontmatter.getTitle();
        if (title == null) {
            title = findHeadingTitle(scanLines);
        }

        Set<String> tags = new LinkedHashSet<>(frontmatter.getTags());
        tags.addAll(extractInlineTags(scanLines));

        int wordCount = countWords(body);

        return ParsedDocument.builder()
            .frontmatter(frontmatter)
            .body(body)
            .title(title)
            .links(extractLinks(scanLines))
            .tags(new ArrayList<>(tags))
            .wordCount(wordCount)
            .readingTimeMinutes(readingTime(wordCount))
            .frontmatterProblem(problem)
            .build();
    }

    /**
     * Parse only the frontmatter block.
     *
     * @throws DocumentParseException if the block is unterminated, is not valid
     *         YAML, or is not a mapping
     */
    public Frontmatter parseFrontmatter(String text) {
        return splitFrontmatter(stripBom(text == null ? "" : text)).frontmatter();
    }

    /**
     * Tag strings in a piece of text, for previews: frontmatter tags plus
     * inline tags, normalised and deduplicated, without implied ancestors.
     */
    public List<String> extractTags(String text) {
        return parse(text).getTags();
    }

    /**
     * Tokens between runs of ASCII whitespace. Other Unicode spaces are part
     * of a token.
     */
    public static int countWords(String body) {
        if (body == null) {
            return 0;
        }
        int count = 0;
        for (String token : WHITESPACE.split(body)) {
            if (!token.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    public static int readingTime(int wordCount) {
        return (wordCount + WORDS_PER_MINUTE - 1) / WORDS_PER_MINUTE;
    }

    private FrontmatterBlock splitFrontmatter(String content) {
        List<String> lines = content.lines().toList();
        if (lines.isEmpty() || !FRONTMATTER_OPEN.matcher(lines.get(0)).matches()) {
            return new FrontmatterBlock(Frontmatter.EMPTY, content);
        }

        int closeIndex = -1;
        for (int i = 1; i < lines.size(); i++) {
            if (FRONTMATTER_CLOSE.matcher(lines.get(i)).matches()) {
                closeIndex = i;
                break;
            }
        }
        if (closeIndex < 0) {
            throw new DocumentParseException("Frontmatter block opened on line 1 is never closed", 1);
        }

        String yaml = String.join("\n", lines.subList(1, closeIndex));
        Frontmatter frontmatter = readYaml(yaml);

        return new FrontmatterBlock(frontmatter, bodyAfterLine(content, closeIndex));
    }

    /**
     * Text following the given zero-based line, keeping the original line endings.
     */
    private String bodyAfterLine(String content, int lineIndex) {
        int pos = 0;
        for (int line = 0; line <= lineIndex; line++) {
            int nl = content.indexOf('\n', pos);
            if (nl < 0) {
                return "";
            }
            pos = nl + 1;
        }
        return content.substring(pos);
    }

    private Frontmatter readYaml(String yaml) {
        if (yaml.isBlank()) {
            return Frontmatter.EMPTY;
        }

        Map<String, Object> fields;
        try {
            fields = yamlMapper.readValue(yaml, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            int line = location != null && location.getLineNr() > 0 ? location.getLineNr() + 1 : 0;
            throw new DocumentParseException("Invalid frontmatter: " + e.getOriginalMessage(), line, e);
        }
        if (fields == null) {
            return Frontmatter.EMPTY;
        }

        List<String> tags = new ArrayList<>();
        for (String tag : stringList(firstPresent(fields, "tags", "tag"), true)) {
            String normalized = TagPath.normalize(tag);
            if (!normalized.isEmpty() && !tags.contains(normalized)) {
                tags.add(normalized);
            }
        }

        return Frontmatter.builder()
            .fields(fields)
            .title(scalar(fields.get("title")))
            .date(parseDate(fields.get("date")))
            .tags(tags)
            .aliases(stringList(firstPresent(fields, "aliases", "alias"), false))
            .status(lowerCase(scalar(fields.get("status"))))
            .build();
    }

    private static Object firstPresent(Map<String, Object> fields, String... keys) {
        for (String key : keys) {
            if (fields.get(key) != null) {
                return fields.get(key);
            }
        }
        return null;
    }

    private static String scalar(Object value) {
        if (value == null || value instanceof Map || value instanceof Collection) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    private static String lowerCase(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    /**
     * A YAML list, or a single string. Tag strings are also split on commas and
     * whitespace; alias strings only on commas.
     */
    private static List<String> stringList(Object value, boolean splitOnWhitespace) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                String s = scalar(item);
                if (s != null) {
                    result.add(s);
                }
            }
            return result;
        }
        String s = scalar(value);
        if (s == null) {
            return result;
        }
        String[] parts = splitOnWhitespace ? LIST_SEPARATOR.split(s) : s.split(",");
        for (String part : parts) {
            if (!part.isBlank()) {
                result.add(part.trim());
            }
        }
        return result;
    }

    private LocalDate parseDate(Object value) {
        String s = scalar(value);
        if (s == null) {
            return null;
        }
        Matcher m = ISO_DATE_PREFIX.matcher(s);
        if (!m.find()) {
            log.debug("Ignoring frontmatter date that is not ISO formatted: {}", s);
            return null;
        }
        try {
            return LocalDate.parse(m.group(1));
        } catch (DateTimeParseException e) {
            log.debug("Ignoring invalid frontmatter date {}: {}", s, e.getMessage());
            return null;
        }
    }

    /**
     * Body lines with fenced code blocks blanked and inline code spans replaced
     * by spaces, so links and tags inside code are ignored while line numbers
     * and columns are preserved.
     */
    private List<String> maskCode(String body) {
        List<String> result = new ArrayList<>();
        String openFence = null;
        for (String line : body.lines().toList()) {
            Matcher fence = FENCE.matcher(line);
            if (openFence == null && fence.find()) {
                openFence = fence.group(1);
                result.add("");
                continue;
            }
            if (openFence != null) {
                if (line.trim().startsWith(openFence)) {
                    openFence = null;
                }
                result.add("");
                continue;
            }

            Matcher code = INLINE_CODE.matcher(line);
            StringBuilder masked = new StringBuilder(line);
            while (code.find()) {
                for (int i = code.start(); i < code.end(); i++) {
                    masked.setCharAt(i, ' ');
                }
            }
            result.add(masked.toString());
        }
        return result;
    }

    private String findHeadingTitle(List<String> lines) {
        for (String line : lines) {
            Matcher m = HEADING_1.matcher(line);
            if (m.matches()) {
                String title = m.group(1).trim();
                if (!title.isEmpty()) {
                    return title;
                }
            }
        }
        return null;
    }

    private List<ExtractedLink> extractLinks(List<String> lines) {
        List<ExtractedLink> links = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher m = WIKI_LINK.matcher(line);
            while (m.find()) {
                ExtractedLink link = toLink(m, line, i + 1);
                if (link != null) {
                    links.add(link);
                }
            }
        }
        return links;
    }

    private ExtractedLink toLink(Matcher m, String line, int lineNumber) {
        String inner = m.group(2);
        String alias = null;
        int pipe = inner.indexOf('|');
        if (pipe >= 0) {
            alias = inner.substring(pipe + 1).trim();
            inner = inner.substring(0, pipe);
        }

        String heading = null;
        int hash = inner.indexOf('#');
        if (hash >= 0) {
            heading = inner.substring(hash + 1).trim();
            inner = inner.substring(0, hash);
        }

        String target = inner.trim();
        if (target.isEmpty()) {
            // [[#Heading]] points inside the same document
            return null;
        }

        String context = line.trim();
        if (context.length() > MAX_CONTEXT_LENGTH) {
            context = context.substring(0, MAX_CONTEXT_LENGTH);
        }

        return ExtractedLink.builder()
            .raw(m.group(0))
            .target(target)
            .alias(alias == null || alias.isEmpty() ? null : alias)
            .heading(heading == null || heading.isEmpty() ? null : heading)
            .embed("!".equals(m.group(1)))
            .lineNumber(lineNumber)
            .context(context)
            .build();
    }

    private List<String> extractInlineTags(List<String> lines) {
        Set<String> tags = new LinkedHashSet<>();
        for (String line : lines) {
            Matcher m = INLINE_TAG.matcher(line);
            while (m.find()) {
                String normalized = TagPath.normalize(m.group(1));
                if (!normalized.isEmpty()) {
                    tags.add(normalized);
                }
            }
        }
        return new ArrayList<>(tags);
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    private static final class FrontmatterBlock {
        private final Frontmatter frontmatter;
        private final String body;

        private FrontmatterBlock(Frontmatter frontmatter, String body) {
            this.frontmatter = frontmatter;
            this.body = body;
        }

        Frontmatter frontmatter() {
            return frontmatter;
        }

        String body() {
            return body;
        }
    }
}
