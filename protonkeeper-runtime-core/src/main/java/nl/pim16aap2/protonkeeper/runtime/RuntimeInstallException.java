package nl.pim16aap2.protonkeeper.runtime;

import lombok.Getter;
import org.jspecify.annotations.Nullable;

import java.io.Serial;
import java.util.Objects;

/**
 * Thrown when an operation on a runtime version cannot be completed.
 */
@Getter
public class RuntimeInstallException extends Exception
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Why the operation failed.
     */
    private final FailureReason reason;

    public RuntimeInstallException(FailureReason reason, String message)
    {
        this(reason, message, null);
    }

    public RuntimeInstallException(FailureReason reason, String message, @Nullable Throwable cause)
    {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason may not be null.");
    }

    /**
     * @return {@code true} if the operation may succeed when attempted again.
     */
    public boolean isRetryable()
    {
        return reason.isRetryable();
    }

    public static RuntimeInstallException cancelled(String versionId)
    {
        return new RuntimeInstallException(
            FailureReason.CANCELLED,
            "Operation for runtime version '%s' was cancelled.".formatted(versionId)
        );
    }
}
