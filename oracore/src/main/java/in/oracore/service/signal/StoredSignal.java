package in.oracore.service.signal;

import in.oracore.domain.signal.Signal;

/**
 * @param created false when the natural key already existed and {@code signal} is the earlier row
 */
public record StoredSignal(Signal signal, boolean created) {
}
