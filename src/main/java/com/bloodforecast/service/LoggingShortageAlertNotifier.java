package com.bloodforecast.service;

import com.bloodforecast.dto.ShortageAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Records alerts in the application log. There is no donor registry to
 * deliver to, so no recipients are reported.
 */
@Slf4j
@Component
public class LoggingShortageAlertNotifier implements ShortageAlertNotifier {

    @Override
    public int deliver(ShortageAlert alert) {
        log.info("Shortage alert | bloodType={} | region={} | risk={} | forecastDate={} | message={}",
                 alert.getBloodType(), alert.getRegion(), alert.getShortageRisk(),
                 alert.getForecastDate(), alert.getMessage());
        return 0;
    }
}
