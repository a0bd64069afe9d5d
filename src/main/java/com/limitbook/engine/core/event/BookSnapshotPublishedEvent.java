package com.limitbook.engine.core.event;

import com.limitbook.engine.core.model.BookSnapshot;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class BookSnapshotPublishedEvent extends ApplicationEvent {
    private final BookSnapshot snapshot;

    public BookSnapshotPublishedEvent(Object source, BookSnapshot snapshot) {
        super(source);
        this.snapshot = snapshot;
    }
}
