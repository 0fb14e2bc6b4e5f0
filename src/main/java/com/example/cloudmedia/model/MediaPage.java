package com.example.cloudmedia.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MediaPage {

    List<MediaItem> items;
    long total;
    int page;
    int pageSize;
}
