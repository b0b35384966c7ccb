package com.example.roofpanel.exception;

/**
 * 면 처리 중 예상하지 못한 오류. 어느 면에서 실패했는지 함께 전달한다.
 */
public class FacetProcessingException extends RoofAnalysisException {

    private static final long serialVersionUID = 1L;

    private final String facetId;

    public FacetProcessingException(String facetId, Throwable cause) {
        super("면 " + facetId + " 처리 실패: " + cause.getMessage(), cause);
        this.facetId = facetId;
    }

    public String getFacetId() {
        return facetId;
    }
}
