package work.lcod.lexicon.format;

/**
 * Structural decoding of base32 CIDv1 strings.
 */
final class Cids {
    private static final String BASE32_ALPHABET = "abcdefghijklmnopqrstuvwxyz234567";
    private static final int CID_VERSION_1 = 0x01;
    private static final int RAW_CODEC = 0x55;
    private static final int SHA2_256 = 0x12;
    private static final int SHA2_256_LENGTH = 32;

    private Cids() {}

    static boolean isRawSha256(String cid) {
        if (cid.length() < 2 || cid.charAt(0) != 'b') {
            return false;
        }
        byte[] bytes = decodeBase32(cid.substring(1));
        if (bytes == null || bytes.length != 4 + SHA2_256_LENGTH) {
            return false;
        }
        return (bytes[0] & 0xff) == CID_VERSION_1
            && (bytes[1] & 0xff) == RAW_CODEC
            && (bytes[2] & 0xff) == SHA2_256
            && (bytes[3] & 0xff) == SHA2_256_LENGTH;
    }

    /**
     * Decodes unpadded lowercase RFC 4648 base32, returning {@code null} on any illegal character.
     */
    static byte[] decodeBase32(String text) {
        byte[] out = new byte[text.length() * 5 / 8];
        int buffer = 0;
        int bits = 0;
        int index = 0;
        for (int i = 0; i < text.length(); i++) {
            int value = BASE32_ALPHABET.indexOf(text.charAt(i));
            if (value < 0) {
                return null;
            }
            buffer = (buffer << 5) | value;
            bits += 5;
            if (bits >= 8) {
                bits -= 8;
                out[index++] = (byte) ((buffer >> bits) & 0xff);
            }
        }
        return out;
    }
}
