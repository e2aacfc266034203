package com.coursetrack.api.course;

import com.coursetrack.api.auth.AuthenticatedLearner;
import com.coursetrack.api.auth.LearnerPrincipal;
import com.coursetrack.api.course.dtos.CourseDtos;
import com.coursetrack.service.course.CourseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CourseController {

    private final CourseService courseService;

    @GetMapping("/courses")
    public List<CourseDtos.Response> findCatalog(@AuthenticatedLearner LearnerPrincipal principal) {
        return courseService.findCatalog(principal).stream()
                .map(CourseDtos.Response::from)
                .toList();
    }

    @GetMapping("/courses/{id}")
    public CourseDtos.Outline getOutline(@AuthenticatedLearner LearnerPrincipal principal,
                                         @PathVariable Long id) {
        return courseService.getOutline(principal, id);
    }

    @PostMapping("/courses")
    @ResponseStatus(HttpStatus.CREATED)
    public CourseDtos.Response create(@AuthenticatedLearner LearnerPrincipal principal,
                                      @Valid @RequestBody CourseDtos.CreateRequest request) {
        return CourseDtos.Response.from(courseService.create(principal, request));
    }

    @PostMapping("/courses/{id}/modules")
    @ResponseStatus(HttpStatus.CREATED)
    public CourseDtos.ModuleResponse addModule(@AuthenticatedLearner LearnerPrincipal principal,
                                               @PathVariable Long id,
                                               @Valid @RequestBody CourseDtos.ModuleRequest request) {
        return CourseDtos.ModuleResponse.from(courseService.addModule(principal, id, request));
    }

    @PostMapping("/modules/{id}/lessons")
    @ResponseStatus(HttpStatus.CREATED)
    public CourseDtos.LessonOutline addLesson(@AuthenticatedLearner LearnerPrincipal principal,
                                              @PathVariable Long id,
                                              @Valid @RequestBody CourseDtos.LessonRequest request) {
        return CourseDtos.LessonOutline.from(courseService.addLesson(principal, id, request));
    }

    @PostMapping("/courses/{id}/publish")
    public CourseDtos.Response publish(@AuthenticatedLearner LearnerPrincipal principal,
                                       @PathVariable Long id) {
        return CourseDtos.Response.from(courseService.publish(principal, id));
    }

    @PostMapping("/courses/{id}/archive")
    public CourseDtos.Response archive(@AuthenticatedLearner LearnerPrincipal principal,
                                       @PathVariable Long id) {
        return CourseDtos.Response.from(courseService.archive(principal, id));
    }
}
