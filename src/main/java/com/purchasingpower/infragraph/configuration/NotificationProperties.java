package com.purchasingpower.infragraph.configuration;

import lombok.Data;

@Data
public class NotificationProperties {

    private boolean enabled = true;
}
