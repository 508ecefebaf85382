package com.clapgrow.summary.whatsapp.model;

/**
 * Authorization state of the WhatsApp account behind the gateway instance.
 */
public enum InstanceState {
    AUTHORIZED,
    UNAUTHORIZED
}
