package restore.bkup.types;

import java.nio.file.Path;

public record RestoreReport(Path targetDir, long filesRestored, long bytesRestored) {
}
