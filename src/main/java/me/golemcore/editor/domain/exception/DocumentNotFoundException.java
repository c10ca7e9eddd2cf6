package me.golemcore.editor.domain.exception;

public class DocumentNotFoundException extends DocumentStoreException {

    private static final long serialVersionUID = 1L;

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
    }
}
