package com.example.textembedding.api;

import java.util.List;

public class DeleteRequest {

    private List<String> ids;

    public DeleteRequest() {}

    public DeleteRequest(List<String> ids) {
        this.ids = ids;
    }

    public List<String> getIds() {
        return ids;
    }

    public void setIds(List<String> ids) {
        this.ids = ids;
    }
}
