package info.isaksson.erland.widgettoir.extract;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Per-file id source for IR nodes: {@code type_contextHash_name_counter}, or
 * {@code type_contextHash_counter} without a name.
 *
 * <p>The context hash is a short stable hash of the file path ({@code global} when there is no
 * file), so ids from different files do not collide when their IR is merged.</p>
 */
public final class IrIdGenerator {
    private final String contextHash;
    private int counter;

    public IrIdGenerator(String file) {
        this.contextHash = file == null || file.isBlank() ? "global" : shortHash(file);
    }

    public String next(String type) {
        return next(type, null);
    }

    public String next(String type, String name) {
        counter++;
        StringBuilder sb = new StringBuilder(type == null || type.isBlank() ? "node" : type)
                .append('_').append(contextHash);
        String n = sanitize(name);
        if (!n.isEmpty()) sb.append('_').append(n);
        return sb.append('_').append(counter).toString();
    }

    public String contextHash() {
        return contextHash;
    }

    public int issued() {
        return counter;
    }

    public void reset() {
        counter = 0;
    }

    private static String sanitize(String name) {
        if (name == null) return "";
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return sb.toString();
    }

    static String shortHash(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (int i = 0; i < 4; i++) {
                hex.append(String.format("%02x", digest[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException(e);
        }
    }
}
