package com.todoinsight.server.web;

import com.todoinsight.server.error.InvalidItemPayloadException;
import com.todoinsight.server.persistence.TodoItem;
import com.todoinsight.server.persistence.TodoItemStore;
import com.todoinsight.server.web.dto.CreateItemRequest;
import com.todoinsight.server.web.dto.ItemResponse;
import com.todoinsight.server.web.dto.UpdateItemRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Todo item API. Each handler maps one request onto one {@link TodoItemStore} call.
 *
 * <ul>
 *   <li>GET /api/items - list all items</li>
 *   <li>POST /api/items - create an item</li>
 *   <li>PUT /api/items/{id} - partially update an item</li>
 *   <li>DELETE /api/items/{id} - remove an item</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/items")
@RequiredArgsConstructor
public class TodoItemController {

    private final TodoItemStore store;

    @GetMapping
    public List<ItemResponse> listItems() {
        return store.listItems().stream()
                .map(ItemResponse::from)
                .toList();
    }

    @PostMapping
    public ResponseEntity<ItemResponse> addItem(@RequestBody CreateItemRequest request) {
        if (request.description() == null) {
            throw new InvalidItemPayloadException("description is required");
        }
        checkDescriptionLength(request.description());
        TodoItem item = store.addItem(request.description());
        log.debug("Created item {}", item.getId());
        URI location = UriComponentsBuilder.fromPath("/api/items/{id}")
                .buildAndExpand(item.getId())
                .toUri();
        return ResponseEntity.created(location).body(ItemResponse.from(item));
    }

    @PutMapping("/{id}")
    public ItemResponse updateItem(@PathVariable String id, @RequestBody UpdateItemRequest request) {
        if (request.description() != null) {
            checkDescriptionLength(request.description());
        }
        return ItemResponse.from(store.updateItem(id, request.toChanges()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteItem(@PathVariable String id) {
        store.deleteItem(id);
        log.debug("Deleted item {}", id);
        return ResponseEntity.ok().build();
    }

    private static void checkDescriptionLength(String description) {
        if (description.codePointCount(0, description.length()) > TodoItem.MAX_DESCRIPTION_LENGTH) {
            throw new InvalidItemPayloadException(
                    "description must be at most " + TodoItem.MAX_DESCRIPTION_LENGTH + " characters");
        }
    }
}
