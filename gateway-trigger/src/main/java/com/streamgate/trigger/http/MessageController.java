package com.streamgate.trigger.http;

import com.streamgate.api.dto.ControlMessageAcceptedDTO;
import com.streamgate.api.response.Response;
import com.streamgate.trigger.application.command.ControlMessageCommandService;
import com.streamgate.types.enums.ResponseCode;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 控制消息提交 API。
 */
@RestController
@RequestMapping("/api/sessions")
public class MessageController {

    private final ControlMessageCommandService controlMessageCommandService;
    private final ClientIdentityResolver clientIdentityResolver;

    public MessageController(ControlMessageCommandService controlMessageCommandService,
                             ClientIdentityResolver clientIdentityResolver) {
        this.controlMessageCommandService = controlMessageCommandService;
        this.clientIdentityResolver = clientIdentityResolver;
    }

    @PostMapping("/{sessionId}/messages")
    public Response<ControlMessageAcceptedDTO> submitMessage(@PathVariable("sessionId") String sessionId,
                                                             @RequestBody Map<String, Object> payload,
                                                             HttpServletRequest request) {
        String clientId = clientIdentityResolver.resolveClientId(request);
        ControlMessageAcceptedDTO data = controlMessageCommandService.submit(clientId, sessionId, payload);
        return Response.<ControlMessageAcceptedDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

}
