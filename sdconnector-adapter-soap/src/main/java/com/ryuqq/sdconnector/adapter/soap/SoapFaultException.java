package com.ryuqq.sdconnector.adapter.soap;

/**
 * 원격 서비스가 SOAP Fault를 반환한 경우.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class SoapFaultException extends SoapCallException {

    private final String faultCode;
    private final String faultString;

    public SoapFaultException(String faultCode, String faultString, int statusCode) {
        super("SOAP fault " + faultCode + ": " + faultString, statusCode);
        this.faultCode = faultCode;
        this.faultString = faultString;
    }

    public String getFaultCode() {
        return faultCode;
    }

    public String getFaultString() {
        return faultString;
    }
}
