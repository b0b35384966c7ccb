package com.example.roofpanel.exception;

/**
 * 면 다각형이 잘못되어 해당 면을 건너뛰어야 하는 경우
 */
public class FacetValidationException extends RoofAnalysisException {

    private static final long serialVersionUID = 1L;

    private final String facetId;

    public FacetValidationException(String facetId, String message) {
        super("면 " + facetId + ": " + message);
        this.facetId = facetId;
    }

    public String getFacetId() {
        return facetId;
    }
}
