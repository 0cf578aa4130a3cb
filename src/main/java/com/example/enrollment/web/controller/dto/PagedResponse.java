package com.example.enrollment.web.controller.dto;

import java.util.List;
import java.util.function.Function;
import lombok.Getter;
import org.springframework.data.domain.Page;

/**
 * { data: [...], pagination: { currentPage, totalPages, totalItems, perPage, hasNext, hasPrev } }
 */
@Getter
public class PagedResponse<T> {

	private final List<T> data;
	private final Pagination pagination;

	private PagedResponse(List<T> data, Pagination pagination) {
		this.data = data;
		this.pagination = pagination;
	}

	public static <E, T> PagedResponse<T> of(Page<E> page, Function<E, T> mapper) {
		// Page는 0부터, 응답은 1부터
		Pagination pagination = new Pagination(
			page.getNumber() + 1,
			page.getTotalPages(),
			page.getTotalElements(),
			page.getSize(),
			page.hasNext(),
			page.hasPrevious());
		return new PagedResponse<>(page.map(mapper).getContent(), pagination);
	}

	@Getter
	public static class Pagination {
		private final int currentPage;
		private final int totalPages;
		private final long totalItems;
		private final int perPage;
		private final boolean hasNext;
		private final boolean hasPrev;

		Pagination(int currentPage, int totalPages, long totalItems, int perPage, boolean hasNext, boolean hasPrev) {
			this.currentPage = currentPage;
			this.totalPages = totalPages;
			this.totalItems = totalItems;
			this.perPage = perPage;
			this.hasNext = hasNext;
			this.hasPrev = hasPrev;
		}
	}
}
