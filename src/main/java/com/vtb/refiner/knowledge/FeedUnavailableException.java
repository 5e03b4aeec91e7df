package com.vtb.refiner.knowledge;

import java.io.IOException;

/**
 * Внешний источник сведений об уязвимостях недоступен или ответил некорректно
 */
public class FeedUnavailableException extends IOException {

    public FeedUnavailableException(String message) {
        super(message);
    }

    public FeedUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
