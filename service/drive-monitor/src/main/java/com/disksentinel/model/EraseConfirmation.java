package com.disksentinel.model;

import lombok.Value;

@Value
public class EraseConfirmation {
    String drive;
    String message;
}
