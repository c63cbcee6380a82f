package com.pytaintscanner.persistence;

import java.io.IOException;

public class IrFormatException extends IOException {
    public IrFormatException(String message) {
        super(message);
    }
}
