package chatfeed.demo.starter;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

@RestController
@RequestMapping("/api/stream")
public class MessageStreamController {

    private final GroupMessageStream stream;

    public MessageStreamController(GroupMessageStream stream) {
        this.stream = stream;
    }

    /**
     * Streams changes to the messages of one group as server-sent events.
     */
    @GetMapping(path = "/group", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter group(@RequestParam("group_uuid") UUID groupUuid) {
        return stream.open(groupUuid);
    }
}
