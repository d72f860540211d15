package com.retail.billkeeper.controller;

import com.retail.billkeeper.dto.CreateDocumentCommand;
import com.retail.billkeeper.dto.DocumentSummaryRow;
import com.retail.billkeeper.dto.DocumentView;
import com.retail.billkeeper.dto.LineItemDraft;
import com.retail.billkeeper.dto.LineItemResponse;
import com.retail.billkeeper.model.Document;
import com.retail.billkeeper.model.DocumentType;
import com.retail.billkeeper.service.DocumentService;
import com.retail.billkeeper.service.DocumentViewService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final DocumentService documentService;
    private final DocumentViewService viewService;

    public DocumentController(DocumentService documentService, DocumentViewService viewService) {
        this.documentService = documentService;
        this.viewService = viewService;
    }

    @PostMapping
    public ResponseEntity<DocumentView> create(@Valid @RequestBody CreateDocumentCommand command) {
        Document document = documentService.createDocument(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(viewService.getView(document.getId()));
    }

    @GetMapping
    public List<DocumentSummaryRow> list(@RequestParam(defaultValue = "INVOICE") DocumentType type) {
        return viewService.listActive(type);
    }

    @GetMapping("/{id}")
    public DocumentView view(@PathVariable Long id) {
        return viewService.getView(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        documentService.softDeleteDocument(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/items")
    public ResponseEntity<LineItemResponse> addItem(@PathVariable Long id, @Valid @RequestBody LineItemDraft draft) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(LineItemResponse.from(documentService.addLineItem(id, draft)));
    }

    @PutMapping("/items/{itemId}")
    public LineItemResponse updateItem(@PathVariable Long itemId, @Valid @RequestBody LineItemDraft draft) {
        return LineItemResponse.from(documentService.updateLineItem(itemId, draft));
    }

    @DeleteMapping("/items/{itemId}")
    public ResponseEntity<Void> deleteItem(@PathVariable Long itemId) {
        documentService.softDeleteLineItem(itemId);
        return ResponseEntity.noContent().build();
    }
}
