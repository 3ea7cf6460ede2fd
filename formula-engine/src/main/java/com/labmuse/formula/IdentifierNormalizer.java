package com.labmuse.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Folds variable names for fuzzy comparison: lower case, Turkish letters
 * mapped to ASCII, whitespace collapsed, trailing commas removed.
 */
public final class IdentifierNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_COMMAS = Pattern.compile(",+$");

    private IdentifierNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            sb.append(fold(name.charAt(i)));
        }
        String folded = WHITESPACE.matcher(sb.toString()).replaceAll(" ").trim();
        folded = TRAILING_COMMAS.matcher(folded).replaceAll("");
        return folded.trim();
    }

    /**
     * Normalized whitespace tokens of at least {@code minLength} characters.
     */
    public static List<String> tokens(String name, int minLength) {
        List<String> result = new ArrayList<>();
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            return result;
        }
        for (String token : normalized.split(" ")) {
            if (token.length() >= minLength) {
                result.add(token);
            }
        }
        return result;
    }

    private static char fold(char c) {
        switch (c) {
            case 'ı': case 'İ': case 'I': return 'i';
            case 'ğ': case 'Ğ': return 'g';
            case 'ü': case 'Ü': return 'u';
            case 'ş': case 'Ş': return 's';
            case 'ö': case 'Ö': return 'o';
            case 'ç': case 'Ç': return 'c';
            default: return Character.toLowerCase(c);
        }
    }
}
