package com.jay.dcf.model.enums;

public enum CellStatus {
    VALID,
    INVALID_RATE_RELATIONSHIP   // discount rate <= terminal growth for this cell
}
