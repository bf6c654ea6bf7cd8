package com.questrail.crossval.compare;

import com.questrail.crossval.api.Fingerprint;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * FingerprintComparator
 * =============================================================================
 * Compares two fingerprints token by token with floating-point tolerance.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Split both fingerprints on whitespace and {@code '='}, preserving order
 *       and dropping empty tokens.</li>
 *   <li>Walk both token lists in lock-step. When both tokens are decimal
 *       numbers they match iff {@code |a - b| <= }{@link #TOLERANCE}; otherwise
 *       the tokens must be equal character for character.</li>
 *   <li>Lists of different length never match.</li>
 * </ol>
 *
 * <p>Numeric tokens are compared as exact decimal values, not as binary
 * doubles: {@code 1.0000000001} and {@code 1.0} differ by exactly
 * {@code 1e-10} and match, where a double subtraction would overshoot the
 * tolerance by a rounding error.</p>
 *
 * <p>Only finite decimal literals ({@code 12}, {@code -0.5}, {@code 1.2e-7})
 * count as numbers. Tokens such as {@code nan}, {@code inf} or {@code 1.0d}
 * are compared as text, so a {@code NaN} never silently matches.</p>
 *
 * <h2>Threading</h2>
 * Stateless and side-effect free. The coordinator calls it synchronously on
 * its single control thread.
 */
public final class FingerprintComparator
{
    /**
     * Absolute tolerance applied to numeric tokens.
     */
    public static final BigDecimal TOLERANCE = new BigDecimal("1e-10");

    private static final Pattern DELIMITERS = Pattern.compile("[\\s=]+");

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private FingerprintComparator() {
    }

    /**
     * @return {@code true} if the two fingerprints are equal within tolerance
     */
    public static boolean matches(Fingerprint a, Fingerprint b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return matches(a.text(), b.text());
    }

    static boolean matches(String a, String b) {
        List<String> left = tokenize(a);
        List<String> right = tokenize(b);
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!tokensMatch(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compares the fingerprint reported by {@code otherId} against the reference
     * reported by {@code firstId}.
     *
     * @return a match, or a mismatch naming both fingerprints and both instances
     */
    public static ComparisonResult compare(int syncPoint,
                                           int firstId, Fingerprint first,
                                           int otherId, Fingerprint other) {
        if (matches(first, other)) {
            return ComparisonResult.match();
        }
        return ComparisonResult.mismatch(String.format(
                "Sync point %d: Instance %d='%s' vs Instance %d='%s'",
                syncPoint, firstId, first.text(), otherId, other.text()));
    }

    static List<String> tokenize(String fingerprint) {
        List<String> tokens = new ArrayList<>();
        for (String token : DELIMITERS.split(fingerprint)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static boolean tokensMatch(String a, String b) {
        if (DECIMAL.matcher(a).matches() && DECIMAL.matcher(b).matches()) {
            try {
                BigDecimal x = new BigDecimal(a);
                BigDecimal y = new BigDecimal(b);
                return x.subtract(y).abs().compareTo(TOLERANCE) <= 0;
            } catch (NumberFormatException | ArithmeticException e) {
                // exponent outside BigDecimal's range; fall through to text
                return a.equals(b);
            }
        }
        return a.equals(b);
    }
}
