package com.example.blog.common;

/**
 * 존재하지 않는 게시글/댓글/사용자 id를 참조한 경우. 404 로 매핑된다.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final Object id;

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: id=" + id);
        this.resource = resource;
        this.id = id;
    }

    public String getResource() { return resource; }

    public Object getId() { return id; }
}
