package com.ragsync.collect;

import java.util.List;

public record HtmlPage(String title, String text, List<String> links) {
    public HtmlPage {
        links = List.copyOf(links);
    }
}
