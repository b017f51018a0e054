package samlverifier.parser;


import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;
import samlverifier.SAMLException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static samlverifier.model.SAMLError.DECODE_ERROR;

public class EncodingUtils {

    private static final Base64 UN_CHUNKED_CODEC = new Base64(0, new byte[]{'\n'}, false, CodecPolicy.STRICT);

    private EncodingUtils() {
    }

    public static String samlEncode(String s) {
        return UN_CHUNKED_CODEC.encodeToString(s.getBytes(UTF_8));
    }

    /**
     * Strict base64 decoding. Whitespace (e.g. line breaks in certificates) is skipped, every other character
     * outside the alphabet is rejected. The input must be padded to a multiple of four characters and padding may
     * only appear at the end.
     *
     * @param s the base64 encoded value
     * @return the decoded bytes
     * @throws SAMLException with {@link samlverifier.model.SAMLError#DECODE_ERROR} for malformed input
     */
    public static byte[] samlDecode(String s) throws SAMLException {
        if (s == null || !Base64.isBase64(s)) {
            throw new SAMLException(DECODE_ERROR, "Input contains characters outside of the base64 alphabet");
        }
        String compact = StringUtils.deleteWhitespace(s);
        String data = StringUtils.stripEnd(compact, "=");
        if (compact.length() % 4 != 0 || compact.length() - data.length() > 2 || data.indexOf('=') >= 0) {
            throw new SAMLException(DECODE_ERROR, "Input is not padded base64");
        }
        try {
            return UN_CHUNKED_CODEC.decode(s);
        } catch (IllegalArgumentException e) {
            throw new SAMLException(DECODE_ERROR, e.getMessage(), e);
        }
    }
}
