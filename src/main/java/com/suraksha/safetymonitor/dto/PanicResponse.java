package com.suraksha.safetymonitor.dto;

import com.suraksha.safetymonitor.entity.PanicAlert;
import lombok.Value;

@Value
public class PanicResponse {

    String status;

    PanicAlert alert;

    public static PanicResponse ok(PanicAlert alert) {
        return new PanicResponse("ok", alert);
    }
}
