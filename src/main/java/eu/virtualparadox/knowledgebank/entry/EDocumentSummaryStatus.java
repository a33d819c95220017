package eu.virtualparadox.knowledgebank.entry;

public enum EDocumentSummaryStatus {
    PENDING,
    READY
}
