package work.lcod.lexicon.format;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.IllformedLocaleException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Syntax predicates for the identifier and string formats used by lexicons.
 */
public final class Syntax {
    private static final Pattern NSID = Pattern.compile(
        "^[a-zA-Z]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
            + "(\\.[a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)+"
            + "(\\.[a-zA-Z][a-zA-Z0-9]{0,62})$"
    );
    private static final Pattern DID = Pattern.compile("^did:[a-z]+:[a-zA-Z0-9._:%-]*[a-zA-Z0-9._-]$");
    private static final Pattern HANDLE = Pattern.compile(
        "^([a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?$"
    );
    private static final Pattern DATETIME = Pattern.compile(
        "^[0-9]{4}-[01][0-9]-[0-3][0-9]T[0-2][0-9]:[0-6][0-9]:[0-6][0-9](\\.[0-9]{1,20})?(Z|[+-][0-2][0-9]:[0-5][0-9])$"
    );
    private static final Pattern URI = Pattern.compile("^\\w+:(?://)?[^\\s/][^\\s]*$");
    private static final Pattern CID = Pattern.compile("^[a-zA-Z0-9+=]{8,256}$");
    private static final Pattern TID = Pattern.compile("^[234567abcdefghij][234567abcdefghijklmnopqrstuvwxyz]{12}$");
    private static final Pattern RECORD_KEY = Pattern.compile("^[a-zA-Z0-9_~.:-]{1,512}$");
    private static final Pattern AT_URI_FRAGMENT = Pattern.compile("^/[a-zA-Z0-9._~:@!$&%')(*+,;=\\-\\[\\]/\\\\]*$");

    private static final int MAX_NSID_LENGTH = 317;
    private static final int MAX_DID_LENGTH = 2048;
    private static final int MAX_HANDLE_LENGTH = 253;
    private static final int MAX_URI_LENGTH = 8192;

    private Syntax() {}

    public static boolean isValidNsid(String value) {
        return value != null
            && value.length() <= MAX_NSID_LENGTH
            && isAscii(value)
            && NSID.matcher(value).matches();
    }

    public static boolean isValidDid(String value) {
        return value != null
            && value.length() <= MAX_DID_LENGTH
            && DID.matcher(value).matches();
    }

    public static boolean isValidHandle(String value) {
        return value != null
            && value.length() <= MAX_HANDLE_LENGTH
            && HANDLE.matcher(value).matches();
    }

    public static boolean isValidAtIdentifier(String value) {
        return isValidDid(value) || isValidHandle(value);
    }

    /**
     * {@code at://<authority>[/<collection>[/<rkey>]][#/<fragment>]}, where the authority is a DID or
     * a handle, the collection an NSID and the record key a valid record key.
     */
    public static boolean isValidAtUri(String value) {
        if (value == null || value.length() > MAX_URI_LENGTH || !value.startsWith("at://")) {
            return false;
        }
        String rest = value.substring("at://".length());
        int hash = rest.indexOf('#');
        if (hash >= 0) {
            if (!AT_URI_FRAGMENT.matcher(rest.substring(hash + 1)).matches()) {
                return false;
            }
            rest = rest.substring(0, hash);
        }
        if (rest.isEmpty() || rest.endsWith("/") || rest.contains("?")) {
            return false;
        }
        String[] segments = rest.split("/", -1);
        if (segments.length > 3) {
            return false;
        }
        if (!isValidAtIdentifier(segments[0])) {
            return false;
        }
        if (segments.length >= 2 && !isValidNsid(segments[1])) {
            return false;
        }
        return segments.length < 3 || isValidRecordKey(segments[2]);
    }

    public static boolean isValidDatetime(String value) {
        if (value == null || !DATETIME.matcher(value).matches() || value.endsWith("-00:00")) {
            return false;
        }
        try {
            OffsetDateTime.parse(truncateFraction(value), DateTimeFormatter.ISO_OFFSET_DATE_TIME);
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    public static boolean isValidUri(String value) {
        return value != null
            && value.length() <= MAX_URI_LENGTH
            && URI.matcher(value).matches();
    }

    public static boolean isValidCid(String value) {
        return value != null
            && CID.matcher(value).matches()
            && !value.startsWith("Qmb");
    }

    /**
     * A CIDv1 in base32 with the raw multicodec and a sha2-256 digest, the only form allowed for blob
     * references.
     */
    public static boolean isValidRawCid(String value) {
        return isValidCid(value) && Cids.isRawSha256(value);
    }

    public static boolean isValidLanguage(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        try {
            new Locale.Builder().setLanguageTag(value);
            return true;
        } catch (IllformedLocaleException ex) {
            return false;
        }
    }

    public static boolean isValidTid(String value) {
        return value != null && TID.matcher(value).matches();
    }

    public static boolean isValidRecordKey(String value) {
        return value != null
            && RECORD_KEY.matcher(value).matches()
            && !".".equals(value)
            && !"..".equals(value);
    }

    private static boolean isAscii(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0x7f) {
                return false;
            }
        }
        return true;
    }

    // java.time only accepts nanosecond precision
    private static String truncateFraction(String value) {
        int dot = value.indexOf('.');
        if (dot < 0) {
            return value;
        }
        int end = dot + 1;
        while (end < value.length() && Character.isDigit(value.charAt(end))) {
            end++;
        }
        if (end - dot - 1 <= 9) {
            return value;
        }
        return value.substring(0, dot + 10) + value.substring(end);
    }
}
