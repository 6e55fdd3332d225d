package io.credway.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.credway.spi.SecretTemplateException;

import static java.util.Locale.ENGLISH;

/**
 * A compiled secret path template such as {@code /concourse/{{.Team}}/{{.Pipeline}}/{{.Secret}}}.
 *
 * Only the {@code Team}, {@code Pipeline} and {@code Secret} fields may be referenced.
 */
public class SecretTemplate
{
    public static final String TEAM = "Team";
    public static final String PIPELINE = "Pipeline";
    public static final String SECRET = "Secret";

    private static final ImmutableSet<String> FIELDS = ImmutableSet.of(TEAM, PIPELINE, SECRET);

    private static final Pattern FIELD_REFERENCE = Pattern.compile("\\s*\\.(?<field>[A-Za-z_][A-Za-z0-9_]*)\\s*");

    public static SecretTemplate build(String name, String source)
    {
        if (Strings.isNullOrEmpty(source)) {
            throw new SecretTemplateException(String.format(ENGLISH,
                        "%s secret template must not be empty", name));
        }
        return new SecretTemplate(name, source, parse(name, source));
    }

    private final String name;
    private final String source;
    private final List<Part> parts;

    private SecretTemplate(String name, String source, List<Part> parts)
    {
        this.name = name;
        this.source = source;
        this.parts = parts;
    }

    public String getName()
    {
        return name;
    }

    public String getSource()
    {
        return source;
    }

    public boolean hasTeam()
    {
        return references(TEAM);
    }

    public boolean hasPipeline()
    {
        return references(PIPELINE);
    }

    private boolean references(String field)
    {
        for (Part part : parts) {
            if (field.equals(part.field)) {
                return true;
            }
        }
        return false;
    }

    public String render(String team, String pipeline, String secret)
    {
        StringBuilder sb = new StringBuilder();
        for (Part part : parts) {
            if (part.field == null) {
                sb.append(part.literal);
            }
            else if (TEAM.equals(part.field)) {
                sb.append(team);
            }
            else if (PIPELINE.equals(part.field)) {
                sb.append(pipeline);
            }
            else {
                sb.append(secret);
            }
        }
        return sb.toString();
    }

    private static List<Part> parse(String name, String source)
    {
        ImmutableList.Builder<Part> parts = ImmutableList.builder();
        int pos = 0;
        while (pos < source.length()) {
            int open = source.indexOf("{{", pos);
            if (open < 0) {
                parts.add(Part.literal(source.substring(pos)));
                break;
            }
            if (open > pos) {
                parts.add(Part.literal(source.substring(pos, open)));
            }
            int close = source.indexOf("}}", open + 2);
            if (close < 0) {
                throw new SecretTemplateException(String.format(ENGLISH,
                            "%s secret template '%s' has an unclosed action", name, source));
            }
            String action = source.substring(open + 2, close);
            Matcher m = FIELD_REFERENCE.matcher(action);
            if (!m.matches()) {
                throw new SecretTemplateException(String.format(ENGLISH,
                            "%s secret template '%s' has an invalid action '{{%s}}'", name, source, action));
            }
            String field = m.group("field");
            if (!FIELDS.contains(field)) {
                throw new SecretTemplateException(String.format(ENGLISH,
                            "%s secret template '%s' references unknown field '%s'; allowed fields are %s",
                            name, source, field, FIELDS));
            }
            parts.add(Part.field(field));
            pos = close + 2;
        }
        return parts.build();
    }

    @Override
    public String toString()
    {
        return source;
    }

    private static class Part
    {
        final String literal;
        final String field;

        private Part(String literal, String field)
        {
            this.literal = literal;
            this.field = field;
        }

        static Part literal(String text)
        {
            return new Part(text, null);
        }

        static Part field(String name)
        {
            return new Part(null, name);
        }
    }
}
