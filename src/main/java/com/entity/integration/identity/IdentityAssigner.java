package com.entity.integration.identity;

import com.entity.integration.core.model.CandidateEntity;
import com.entity.integration.core.model.EntityType;
import com.entity.integration.core.model.LocationAttributes;
import com.entity.integration.core.model.TimeAttributes;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;

/**
 * Derives deterministic global ids from an entity's type and best available signature.
 *
 * <p>Signature selection, first applicable wins:</p>
 * <ol>
 *   <li>LOCATION with coordinates: {@code LOC_<lat>_<lon>}, rounded to 5 decimal places</li>
 *   <li>TIME with a start date: {@code TIME_<start_date>}</li>
 *   <li>anything else: {@code <TYPE>_<text>} with the text lowercased and spaces replaced by underscores</li>
 * </ol>
 *
 * <p>The id is the first 12 hex characters of the MD5 of the signature. Identical
 * signatures always yield identical ids; the assigner is stateless.</p>
 */
public class IdentityAssigner {

    public static final int ID_LENGTH = 12;
    private static final int COORDINATE_SCALE = 5;
    private static final BigDecimal SCIENTIFIC_BELOW = new BigDecimal("0.0001");

    /**
     * Assigns a global id to an incoming candidate.
     */
    public String assign(CandidateEntity candidate) {
        return assign(candidate.getType(), candidate.getComparableText(),
                candidate.getLocation(), candidate.getTime());
    }

    /**
     * Assigns a global id.
     *
     * @param type           entity type
     * @param normalizedText normalized text, or the raw text when no normalized form exists
     * @param location       location attributes, may be null
     * @param time           time attributes, may be null
     * @return a 12 character hex id
     */
    public String assign(EntityType type, String normalizedText,
                         LocationAttributes location, TimeAttributes time) {
        return ContentHash.md5Prefix(signature(type, normalizedText, location, time), ID_LENGTH);
    }

    /**
     * Builds the signature string that seeds the id hash.
     */
    public String signature(EntityType type, String normalizedText,
                            LocationAttributes location, TimeAttributes time) {
        Objects.requireNonNull(type, "type is required");
        if (type == EntityType.LOCATION && location != null && location.hasCoordinates()) {
            return "LOC_" + roundCoordinate(location.getLatitude())
                    + "_" + roundCoordinate(location.getLongitude());
        }
        if (type == EntityType.TIME && time != null && time.getStartDate() != null) {
            return "TIME_" + time.getStartDate();
        }
        String text = normalizedText != null ? normalizedText : "";
        return type.name() + "_" + text.toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    /**
     * Rounds to 5 decimal places and renders the result in the shortest form: plain decimal
     * with at least one fractional digit ("48.20825", "16.0"), or {@code <digits>e-<NN>} below
     * 1e-4 ("5e-05"). Rounding is half-even on the exact binary value.
     */
    static String roundCoordinate(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Coordinate is not finite: " + value);
        }
        BigDecimal rounded = new BigDecimal(value)
                .setScale(COORDINATE_SCALE, RoundingMode.HALF_EVEN)
                .stripTrailingZeros();
        if (rounded.signum() == 0) {
            return Math.copySign(1.0, value) < 0 ? "-0.0" : "0.0";
        }
        if (rounded.abs().compareTo(SCIENTIFIC_BELOW) < 0) {
            return scientific(rounded);
        }
        String plain = rounded.toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    private static String scientific(BigDecimal value) {
        String digits = value.unscaledValue().abs().toString();
        int exponent = digits.length() - value.scale() - 1;
        StringBuilder sb = new StringBuilder();
        if (value.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append(exponent < 0 ? "e-" : "e+");
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            sb.append('0');
        }
        return sb.append(magnitude).toString();
    }
}
