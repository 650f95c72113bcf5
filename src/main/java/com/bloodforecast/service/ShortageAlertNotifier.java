package com.bloodforecast.service;

import com.bloodforecast.dto.ShortageAlert;

/**
 * Delivers shortage alerts to donors. Implementations return the number of
 * recipients reached; a failure must be thrown so the forecast stays unalerted.
 */
public interface ShortageAlertNotifier {

    int deliver(ShortageAlert alert);
}
