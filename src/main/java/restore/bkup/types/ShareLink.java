package restore.bkup.types;

import java.time.Instant;

public record ShareLink(String remotePath, Instant expiresAt, String url) {
}
