package in.co.pricematch.services;

import in.co.pricematch.pojos.Classification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A forbidden rule written in the pattern mini-language, parsed once at load time.
 *
 * <p>Each side of a rule is a {@link Term}:</p>
 * <ul>
 *   <li>{@code type:subtype} - {@link CategoryTerm}, matches a product classified exactly so</li>
 *   <li>{@code opt1|opt2|...} - {@link AlternationTerm}, matches when any option is a substring
 *       of the lowercased name</li>
 *   <li>anything else - {@link KeywordTerm}, a plain substring match</li>
 * </ul>
 * A rule fires when its left term matches one product and its right term the other, in either
 * orientation. Terms that fail to parse become {@link #NEVER} and the rule can never fire.
 */
public final class ForbiddenPattern {

    public enum Kind {
        CATEGORY,
        ALTERNATION,
        KEYWORD
    }

    private final String source;
    private final Term left;
    private final Term right;

    private ForbiddenPattern(String source, Term left, Term right) {
        this.source = source;
        this.left = left;
        this.right = right;
    }

    public static ForbiddenPattern parse(String left, String right) {
        return new ForbiddenPattern(left + " vs " + right, parseTerm(left), parseTerm(right));
    }

    /**
     * True when the raw token uses pattern syntax rather than naming a bare type.
     */
    public static boolean isPatternToken(String token) {
        return token != null && (token.indexOf(':') >= 0 || token.indexOf('|') >= 0);
    }

    static Term parseTerm(String token) {
        if (token == null) {
            return NEVER;
        }
        String t = token.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty()) {
            return NEVER;
        }
        if (t.indexOf(':') >= 0) {
            String[] parts = t.split(":", -1);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                return NEVER;
            }
            return new CategoryTerm(parts[0].trim(), parts[1].trim());
        }
        if (t.indexOf('|') >= 0) {
            List<String> options = new ArrayList<>();
            for (String option : t.split("\\|")) {
                if (!option.isBlank()) {
                    options.add(option.trim());
                }
            }
            return options.isEmpty() ? NEVER : new AlternationTerm(options);
        }
        return new KeywordTerm(t);
    }

    /**
     * @param nameA lowercased raw name of product A
     * @param nameB lowercased raw name of product B
     */
    public boolean matches(String nameA, Classification classA, String nameB, Classification classB) {
        return (left.matches(nameA, classA) && right.matches(nameB, classB))
                || (left.matches(nameB, classB) && right.matches(nameA, classA));
    }

    public Kind getKind() {
        return left.kind();
    }

    public boolean isParsable() {
        return left != NEVER && right != NEVER;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }

    // =========================================================================
    // Terms
    // =========================================================================

    interface Term {
        boolean matches(String lowerName, Classification classification);

        Kind kind();
    }

    static final Term NEVER = new Term() {
        @Override
        public boolean matches(String lowerName, Classification classification) {
            return false;
        }

        @Override
        public Kind kind() {
            return Kind.KEYWORD;
        }
    };

    static final class CategoryTerm implements Term {
        private final String type;
        private final String subtype;

        CategoryTerm(String type, String subtype) {
            this.type = type;
            this.subtype = subtype;
        }

        @Override
        public boolean matches(String lowerName, Classification classification) {
            return type.equals(classification.getType()) && subtype.equals(classification.getSubtype());
        }

        @Override
        public Kind kind() {
            return Kind.CATEGORY;
        }
    }

    static final class AlternationTerm implements Term {
        private final List<String> options;

        AlternationTerm(List<String> options) {
            this.options = List.copyOf(options);
        }

        @Override
        public boolean matches(String lowerName, Classification classification) {
            for (String option : options) {
                if (lowerName.contains(option)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Kind kind() {
            return Kind.ALTERNATION;
        }
    }

    static final class KeywordTerm implements Term {
        private final String keyword;

        KeywordTerm(String keyword) {
            this.keyword = keyword;
        }

        @Override
        public boolean matches(String lowerName, Classification classification) {
            return lowerName.contains(keyword);
        }

        @Override
        public Kind kind() {
            return Kind.KEYWORD;
        }
    }
}
