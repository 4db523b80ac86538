package com.tradinggateway.gate;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
public class RequestError {

    private final RequestErrorType type;
    private final String message;
}
