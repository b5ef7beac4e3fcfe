package com.docfederation.rewrite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YAML front-matter block at the top of a markdown file.
 *
 * @param body content after the closing delimiter
 */
@Slf4j
public record FrontMatter(Map<String, Object> fields, String body) {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final Pattern BLOCK = Pattern.compile("\\A---\\r?\\n(.*?)\\r?\\n---[ \\t]*(?:\\r?\\n|\\z)",
            Pattern.DOTALL);

    public static FrontMatter parse(String content) {
        Matcher matcher = BLOCK.matcher(content);
        if (!matcher.find()) {
            return new FrontMatter(Map.of(), content);
        }
        String body = content.substring(matcher.end());
        try {
            Map<String, Object> fields = YAML.readValue(matcher.group(1), new TypeReference<Map<String, Object>>() {});
            return new FrontMatter(fields == null ? Map.of() : fields, body);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed front matter: {}", e.getOriginalMessage());
            return new FrontMatter(Map.of(), body);
        }
    }

    public String string(String key) {
        Object value = fields.get(key);
        return value == null ? null : value.toString().trim();
    }

    public Integer integer(String key) {
        Object value = fields.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric {}: {}", key, value);
            }
        }
        return null;
    }

    public boolean flag(String key) {
        Object value = fields.get(key);
        return value instanceof Boolean b ? b : value != null && Boolean.parseBoolean(value.toString());
    }
}
